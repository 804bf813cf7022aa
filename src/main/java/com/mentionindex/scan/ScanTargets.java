package com.mentionindex.scan;

import com.mentionindex.model.PersonRecord;
import com.mentionindex.text.NameNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * 一组人员记录的扫描视图：规范化姓名到代表记录、姓名长度集合与预编译正则。
 *
 * <p>同名记录只保留第一条作为代表，提及按规范化姓名计一次。
 * 行内匹配使用保留大小写的匹配文本，长度与行内出现一致。
 */
final class ScanTargets {

    static final ScanTargets EMPTY = new ScanTargets(List.of());

    private static final String BOUNDARY_BEFORE = "(?<![\\p{L}\\p{Nd}])";
    private static final String BOUNDARY_AFTER = "(?![\\p{L}\\p{Nd}])";

    private final List<PersonRecord> source;
    private final Map<String, PersonRecord> byName = new LinkedHashMap<>();
    private final Map<String, String> matchTexts = new HashMap<>();
    private final NavigableSet<Integer> nameLengths = new TreeSet<>();
    private final List<String> irregularNames = new ArrayList<>();
    private final Map<String, Pattern> patterns = new HashMap<>();

    ScanTargets(List<PersonRecord> records) {
        this.source = records;
        for (PersonRecord record : records) {
            String name = record.canonicalName();
            if (byName.putIfAbsent(name, record) == null) {
                String matchText = matchText(record);
                matchTexts.put(name, matchText);
                nameLengths.add(matchText.length());
                if (!WordBoundaries.isWordChar(matchText.charAt(0))) {
                    irregularNames.add(name);
                }
            }
        }
    }

    /**
     * 行内匹配文本：合并空白后的原始姓名。
     */
    static String matchText(PersonRecord record) {
        return NameNormalizer.collapseWhitespace(record.fullName());
    }

    /**
     * 是否由同一组记录构建。
     */
    boolean isBuiltFrom(List<PersonRecord> records) {
        return source == records || (source.size() == records.size() && source.equals(records));
    }

    boolean isEmpty() {
        return byName.isEmpty();
    }

    PersonRecord recordFor(String canonicalName) {
        return byName.get(canonicalName);
    }

    String matchTextFor(String canonicalName) {
        return matchTexts.get(canonicalName);
    }

    Map<String, PersonRecord> byName() {
        return Collections.unmodifiableMap(byName);
    }

    NavigableSet<Integer> nameLengths() {
        return Collections.unmodifiableNavigableSet(nameLengths);
    }

    /**
     * 首字符不是字母或数字的姓名，无法从词起始位置定位，需要直接扫描。
     */
    List<String> irregularNames() {
        return Collections.unmodifiableList(irregularNames);
    }

    Pattern patternFor(String canonicalName) {
        return patterns.computeIfAbsent(canonicalName, name -> Pattern.compile(
                BOUNDARY_BEFORE + Pattern.quote(matchTexts.get(name)) + BOUNDARY_AFTER,
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }
}
