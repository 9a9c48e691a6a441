package com.ragplatform.auth.dto;

import com.ragplatform.auth.exception.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body: {@code {"detail": "..."}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    private String detail;

    public static ErrorResponse of(ErrorCode errorCode) {
        return new ErrorResponse(errorCode.getDefaultMessage());
    }
}
