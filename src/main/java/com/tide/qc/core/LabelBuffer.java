package com.tide.qc.core;

import java.util.Arrays;

/**
 * 尖峰标签缓冲区
 *
 * 单写者：按下标顺序逐个写入，每个下标只写一次。
 * 读者通过 {@link #view()} 获得只读视图，只能看到已定稿的下标。
 */
public class LabelBuffer {

    private final boolean[] labels;
    private int cursor;

    private final LabelView view = new LabelView() {
        @Override
        public boolean isSpike(int index) {
            return read(index);
        }

        @Override
        public int finalizedCount() {
            return cursor;
        }

        @Override
        public int size() {
            return labels.length;
        }
    };

    public LabelBuffer(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("标签长度不能为负数: " + size);
        }
        this.labels = new boolean[size];
        this.cursor = 0;
    }

    /**
     * 写入下一个下标的标签
     *
     * @param index 必须等于当前游标
     */
    public void write(int index, boolean spike) {
        if (index != cursor) {
            throw new IllegalStateException("标签必须按顺序写入: 期望 " + cursor + ", 实际 " + index);
        }
        labels[index] = spike;
        cursor++;
    }

    public boolean read(int index) {
        if (index < 0 || index >= cursor) {
            throw new IllegalStateException("标签尚未定稿: " + index + " (已定稿 " + cursor + ")");
        }
        return labels[index];
    }

    public LabelView view() {
        return view;
    }

    public int finalizedCount() {
        return cursor;
    }

    public int size() {
        return labels.length;
    }

    public boolean isComplete() {
        return cursor == labels.length;
    }

    /**
     * 标签快照，未定稿部分保持默认 false
     */
    public boolean[] toArray() {
        return Arrays.copyOf(labels, labels.length);
    }
}
