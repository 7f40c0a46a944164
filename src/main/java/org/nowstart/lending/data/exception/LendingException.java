package org.nowstart.lending.data.exception;

import lombok.Getter;
import org.nowstart.lending.data.type.LendingErrorCode;
import org.springframework.http.HttpStatus;

@Getter
public class LendingException extends RuntimeException {

    private final LendingErrorCode errorCode;

    public LendingException(LendingErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public LendingException(LendingErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return errorCode.getStatus();
    }

    public String getCode() {
        return errorCode.getCode();
    }
}
