package com.tide.qc.core;

/**
 * 输入数据异常（列缺失、格式错误、时间乱序）
 */
public class SampleDataException extends Exception {

    public SampleDataException(String message) {
        super(message);
    }

    public SampleDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
