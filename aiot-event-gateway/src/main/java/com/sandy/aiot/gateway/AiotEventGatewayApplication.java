package com.sandy.aiot.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class AiotEventGatewayApplication {

	public static void main(String[] args) {
		SpringApplication.run(AiotEventGatewayApplication.class, args);
	}

}
