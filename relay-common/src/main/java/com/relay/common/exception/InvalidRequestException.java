package com.relay.common.exception;

/**
 * 调用方请求参数非法。
 */
public class InvalidRequestException extends RelayException implements ErrorKind.Classified {

    public InvalidRequestException(String message) {
        super("INVALID_REQUEST", message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.FATAL;
    }
}
