package com.tide.qc.core;

/**
 * 尖峰标签的只读视图
 * 只能读取已经定稿的下标
 */
public interface LabelView {

    /**
     * 下标 index 是否被判定为尖峰
     *
     * @throws IllegalStateException 下标尚未定稿
     */
    boolean isSpike(int index);

    /**
     * 已定稿的标签数量，下标 [0, finalizedCount) 可读
     */
    int finalizedCount();

    /**
     * 序列总长度
     */
    int size();
}
