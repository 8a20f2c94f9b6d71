package com.example.chatrelay.media;

public class MediaFetchResult {

    public enum ErrorKind { INVALID_URL, HTTP_STATUS, IO }

    private final byte[] content;
    private final String contentType;
    private final ErrorKind errorKind;
    private final String message;

    private MediaFetchResult(byte[] content, String contentType, ErrorKind errorKind, String message) {
        this.content = content;
        this.contentType = contentType;
        this.errorKind = errorKind;
        this.message = message;
    }

    public static MediaFetchResult success(byte[] content, String contentType) {
        return new MediaFetchResult(content, contentType, null, null);
    }

    public static MediaFetchResult failure(ErrorKind kind, String message) {
        return new MediaFetchResult(null, null, kind, message);
    }

    public boolean isSuccess() { return errorKind == null; }
    public byte[] getContent() { return content; }
    public String getContentType() { return contentType; }
    public ErrorKind getErrorKind() { return errorKind; }
    public String getMessage() { return message; }
}
