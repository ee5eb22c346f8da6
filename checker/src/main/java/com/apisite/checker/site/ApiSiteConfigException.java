package com.apisite.checker.site;

public class ApiSiteConfigException extends RuntimeException {
    public ApiSiteConfigException(String message) {
        super(message);
    }

    public ApiSiteConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
