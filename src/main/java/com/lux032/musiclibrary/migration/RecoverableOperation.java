package com.lux032.musiclibrary.migration;

import java.io.IOException;

/**
 * 可重试的文件操作
 */
@FunctionalInterface
public interface RecoverableOperation {

    /**
     * @param merge 目标已存在时是否合并
     */
    void run(boolean merge) throws IOException;
}
