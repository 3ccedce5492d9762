package com.rit.diff;

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * 行级 diff，编辑脚本由 java-diff-utils 的 Myers 算法给出，公共行即最长公共子序列。
 * 按顺序拼接 EQUAL 与 REMOVED 段得到旧文本，拼接 EQUAL 与 ADDED 段得到新文本。
 * 同一处修改中 REMOVED 段在 ADDED 段之前；相邻同类行合并为一段。
 */
@UtilityClass
public class LineDiff {

    /**
     * 计算 oldText → newText 的行级编辑脚本。
     */
    public static List<DiffSegment> diff(String oldText, String newText) {
        List<String> oldLines = splitLines(oldText);
        List<String> newLines = splitLines(newText);

        Segments result = new Segments();
        List<String> removed = new ArrayList<>();
        List<String> added = new ArrayList<>();
        int pos = 0;
        for (AbstractDelta<String> delta : DiffUtils.diff(oldLines, newLines).getDeltas()) {
            int deltaStart = delta.getSource().getPosition();
            if (deltaStart > pos) {
                flush(result, removed, added);
                for (String line : oldLines.subList(pos, deltaStart)) {
                    result.append(DiffSegment.Kind.EQUAL, line);
                }
            }
            removed.addAll(delta.getSource().getLines());
            added.addAll(delta.getTarget().getLines());
            pos = deltaStart + delta.getSource().size();
        }
        flush(result, removed, added);
        for (String line : oldLines.subList(pos, oldLines.size())) {
            result.append(DiffSegment.Kind.EQUAL, line);
        }
        return result.finish();
    }

    // 两个公共段之间的改动先输出删除行，再输出新增行
    private static void flush(Segments result, List<String> removed, List<String> added) {
        for (String line : removed) {
            result.append(DiffSegment.Kind.REMOVED, line);
        }
        for (String line : added) {
            result.append(DiffSegment.Kind.ADDED, line);
        }
        removed.clear();
        added.clear();
    }

    /**
     * 按 \n 切分为整行，每行保留行尾换行符；最后一行没有换行符时单独成行。空文本没有行。
     */
    public static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int k = 0; k < text.length(); k++) {
            if (text.charAt(k) == '\n') {
                lines.add(text.substring(start, k + 1));
                start = k + 1;
            }
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return lines;
    }

    /** 把相邻同类行合并为一段。 */
    private static final class Segments {

        private final List<DiffSegment> segments = new ArrayList<>();
        private final StringBuilder text = new StringBuilder();
        private DiffSegment.Kind kind;

        void append(DiffSegment.Kind lineKind, String line) {
            if (kind != lineKind) {
                close();
                kind = lineKind;
            }
            text.append(line);
        }

        List<DiffSegment> finish() {
            close();
            return segments;
        }

        private void close() {
            if (kind != null) {
                segments.add(new DiffSegment(kind, text.toString()));
                text.setLength(0);
                kind = null;
            }
        }
    }

    /** 用 EQUAL 与给定类型的段重建文本。 */
    public static String reconstruct(List<DiffSegment> segments, DiffSegment.Kind side) {
        StringBuilder sb = new StringBuilder();
        for (DiffSegment s : segments) {
            if (s.getKind() == DiffSegment.Kind.EQUAL || s.getKind() == side) {
                sb.append(s.getText());
            }
        }
        return sb.toString();
    }
}
