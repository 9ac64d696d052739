package com.lux032.musiclibrary.error;

/**
 * 携带 {@link LibraryError} 的受检异常
 */
public class LibraryException extends Exception {

    private final LibraryError error;

    public LibraryException(LibraryError error) {
        super(error.getMessage());
        this.error = error;
    }

    public LibraryException(LibraryError error, Throwable cause) {
        super(error.getMessage(), cause);
        this.error = error;
    }

    public LibraryException(ErrorKind kind, String message) {
        this(LibraryError.of(kind, message));
    }

    public LibraryException(ErrorKind kind, String message, Throwable cause) {
        this(LibraryError.of(kind, message), cause);
    }

    public LibraryError getError() {
        return error;
    }

    public ErrorKind getKind() {
        return error.getKind();
    }
}
