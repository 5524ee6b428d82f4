package com.sandy.aiot.gateway.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiError {
    private boolean success;
    private String code;
    private String message;

    public static ApiError of(String code, String message) {
        return new ApiError(false, code, message);
    }
}
