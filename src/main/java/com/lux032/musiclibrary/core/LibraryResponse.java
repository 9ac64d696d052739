package com.lux032.musiclibrary.core;

import com.lux032.musiclibrary.error.LibraryError;
import lombok.Data;

/**
 * 对外接口的统一返回结构: status 为 success 或 error
 */
@Data
public class LibraryResponse<T> {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    private String status;
    private T data;
    private LibraryError error;

    public static <T> LibraryResponse<T> ok(T data) {
        LibraryResponse<T> response = new LibraryResponse<>();
        response.setStatus(STATUS_SUCCESS);
        response.setData(data);
        return response;
    }

    public static <T> LibraryResponse<T> error(LibraryError error) {
        LibraryResponse<T> response = new LibraryResponse<>();
        response.setStatus(STATUS_ERROR);
        response.setError(error);
        return response;
    }

    public boolean isSuccess() {
        return STATUS_SUCCESS.equals(status);
    }
}
