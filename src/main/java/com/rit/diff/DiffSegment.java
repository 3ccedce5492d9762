package com.rit.diff;

import lombok.Value;

/**
 * 行级 diff 的一段：若干连续的整行（含行尾换行符）及其类型。
 */
@Value
public class DiffSegment {

    public enum Kind { EQUAL, ADDED, REMOVED }

    Kind kind;
    String text;
}
