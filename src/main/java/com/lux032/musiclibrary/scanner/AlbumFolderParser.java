package com.lux032.musiclibrary.scanner;

import com.lux032.musiclibrary.model.AlbumType;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 专辑文件夹名解析
 *
 * <p>支持的命名:
 * <ul>
 *   <li>"YYYY - 专辑名 (版本)"</li>
 *   <li>"YYYY - 专辑名"</li>
 *   <li>"专辑名 (版本)"</li>
 *   <li>"专辑名"</li>
 * </ul>
 * 规则按顺序尝试，年份不在 1950-2030 或括号内容不是版本关键字时，规则不适用，继续尝试下一条。
 */
public class AlbumFolderParser {

    public static final int MIN_YEAR = 1950;
    public static final int MAX_YEAR = 2030;

    public enum PatternType {
        DEFAULT_WITH_EDITION(true),
        DEFAULT_NO_EDITION(true),
        LEGACY_WITH_EDITION(false),
        LEGACY_NO_EDITION(false);

        private final boolean yearPrefixed;

        PatternType(boolean yearPrefixed) {
            this.yearPrefixed = yearPrefixed;
        }

        public boolean isYearPrefixed() {
            return yearPrefixed;
        }
    }

    // 文件夹名规则表，顺序即优先级
    private static final List<NameRule> NAME_RULES = Collections.unmodifiableList(Arrays.asList(
        new NameRule(PatternType.DEFAULT_WITH_EDITION, "^(\\d{4})\\s*-\\s*(.+?)\\s*\\(([^)]+)\\)$", 1, 2, 3),
        new NameRule(PatternType.DEFAULT_NO_EDITION, "^(\\d{4})\\s*-\\s*(.+)$", 1, 2, 0),
        new NameRule(PatternType.LEGACY_WITH_EDITION, "^(.+?)\\s*\\(([^)]+)\\)$", 0, 1, 2),
        new NameRule(PatternType.LEGACY_NO_EDITION, "^(.+)$", 0, 1, 0)
    ));

    // 版本关键字（整词匹配）
    private static final Pattern EDITION_KEYWORDS = Pattern.compile(
        "\\b(deluxe|limited|anniversary|remaster(ed)?|remix(es|ed)?|special|expanded|director's cut|collector's"
            + "|premium|ultimate|bonus|extended|platinum|gold|complete|definitive"
            + "|live|demo|instrumental|split|acoustic|unplugged)\\b",
        Pattern.CASE_INSENSITIVE);

    // 从名称推断类型，顺序即优先级
    private static final List<TypeRule> TYPE_RULES = Collections.unmodifiableList(Arrays.asList(
        new TypeRule(AlbumType.LIVE, "\\b(live|concert|unplugged|acoustic)\\b"),
        new TypeRule(AlbumType.COMPILATION, "\\b(greatest hits|best of|anthology|compilation)\\b"),
        new TypeRule(AlbumType.EP, "(\\bep\\b|\\be\\.p\\.)"),
        new TypeRule(AlbumType.SINGLE, "\\bsingle\\b"),
        new TypeRule(AlbumType.DEMO, "\\b(demos?|early recordings|unreleased)\\b"),
        new TypeRule(AlbumType.INSTRUMENTAL, "\\binstrumentals?\\b"),
        new TypeRule(AlbumType.SPLIT, "(\\bsplit\\b|\\bvs\\.?(\\s|$)|\\bversus\\b)")
    ));

    // 版本名称标准化
    private static final Map<String, String> EDITION_STANDARD_NAMES = new LinkedHashMap<>();

    static {
        EDITION_STANDARD_NAMES.put("deluxe", "Deluxe Edition");
        EDITION_STANDARD_NAMES.put("deluxe edition", "Deluxe Edition");
        EDITION_STANDARD_NAMES.put("limited", "Limited Edition");
        EDITION_STANDARD_NAMES.put("limited edition", "Limited Edition");
        EDITION_STANDARD_NAMES.put("remaster", "Remastered");
        EDITION_STANDARD_NAMES.put("remastered", "Remastered");
        EDITION_STANDARD_NAMES.put("anniversary", "Anniversary Edition");
        EDITION_STANDARD_NAMES.put("anniversary edition", "Anniversary Edition");
        EDITION_STANDARD_NAMES.put("special", "Special Edition");
        EDITION_STANDARD_NAMES.put("special edition", "Special Edition");
        EDITION_STANDARD_NAMES.put("expanded", "Expanded Edition");
        EDITION_STANDARD_NAMES.put("expanded edition", "Expanded Edition");
        EDITION_STANDARD_NAMES.put("collector's", "Collector's Edition");
        EDITION_STANDARD_NAMES.put("collector's edition", "Collector's Edition");
        EDITION_STANDARD_NAMES.put("demo", "Demo");
        EDITION_STANDARD_NAMES.put("instrumental", "Instrumental");
        EDITION_STANDARD_NAMES.put("live", "Live");
        EDITION_STANDARD_NAMES.put("split", "Split");
    }

    /**
     * 解析不在类型文件夹中的专辑文件夹，类型从名称推断
     */
    public ParsedAlbumFolder parse(String folderName) {
        return parse(folderName, null);
    }

    /**
     * 解析专辑文件夹，typeFolderName 是所在类型文件夹名（可为 null），其类型优先于名称推断
     */
    public ParsedAlbumFolder parse(String folderName, String typeFolderName) {
        String name = folderName == null ? "" : folderName.trim();
        ParsedAlbumFolder parsed = new ParsedAlbumFolder();
        parsed.setFolderName(name);

        for (NameRule rule : NAME_RULES) {
            if (rule.apply(name, parsed)) {
                break;
            }
        }

        AlbumType folderType = typeFolderName != null ? AlbumType.fromTypeFolderName(typeFolderName) : null;
        if (folderType != null) {
            parsed.setAlbumType(folderType);
            parsed.setTypeFromFolder(true);
        } else {
            parsed.setAlbumType(inferType(parsed.getAlbumName(), parsed.getEdition()));
        }
        return parsed;
    }

    public static boolean isValidYear(String year) {
        if (year == null || !year.matches("\\d{4}")) {
            return false;
        }
        int value = Integer.parseInt(year);
        return value >= MIN_YEAR && value <= MAX_YEAR;
    }

    public static boolean isEdition(String text) {
        return text != null && EDITION_KEYWORDS.matcher(text).find();
    }

    /**
     * 从专辑名和版本推断类型，都不匹配时为 Album
     */
    public static AlbumType inferType(String albumName, String edition) {
        String[] candidates = {edition, albumName};
        for (String candidate : candidates) {
            if (candidate == null || candidate.isEmpty()) {
                continue;
            }
            for (TypeRule rule : TYPE_RULES) {
                if (rule.pattern.matcher(candidate).find()) {
                    return rule.type;
                }
            }
        }
        return AlbumType.ALBUM;
    }

    public static String normalizeEdition(String edition) {
        if (edition == null || edition.trim().isEmpty()) {
            return "";
        }
        String trimmed = edition.trim();
        return EDITION_STANDARD_NAMES.getOrDefault(trimmed.toLowerCase(Locale.ROOT), trimmed);
    }

    /**
     * 生成标准文件夹名 "YYYY - 专辑名 (版本)"，没有年份时省略年份前缀
     */
    public static String formatFolderName(String albumName, String year, String edition) {
        StringBuilder sb = new StringBuilder();
        if (year != null && !year.isEmpty()) {
            sb.append(year).append(" - ");
        }
        sb.append(albumName.trim());
        if (edition != null && !edition.isEmpty()) {
            sb.append(" (").append(edition.trim()).append(")");
        }
        return sb.toString();
    }

    private static final class NameRule {
        private final PatternType type;
        private final Pattern pattern;
        private final int yearGroup;
        private final int nameGroup;
        private final int editionGroup;

        private NameRule(PatternType type, String regex, int yearGroup, int nameGroup, int editionGroup) {
            this.type = type;
            this.pattern = Pattern.compile(regex);
            this.yearGroup = yearGroup;
            this.nameGroup = nameGroup;
            this.editionGroup = editionGroup;
        }

        boolean apply(String folderName, ParsedAlbumFolder parsed) {
            Matcher matcher = pattern.matcher(folderName);
            if (!matcher.matches()) {
                return false;
            }
            String year = yearGroup > 0 ? matcher.group(yearGroup) : "";
            String edition = editionGroup > 0 ? matcher.group(editionGroup).trim() : "";
            if (yearGroup > 0 && !isValidYear(year)) {
                return false;
            }
            if (editionGroup > 0 && !isEdition(edition)) {
                return false;
            }
            parsed.setYear(year);
            parsed.setAlbumName(matcher.group(nameGroup).trim());
            parsed.setEdition(edition);
            parsed.setPatternType(type);
            return true;
        }
    }

    private static final class TypeRule {
        private final AlbumType type;
        private final Pattern pattern;

        private TypeRule(AlbumType type, String regex) {
            this.type = type;
            this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        }
    }
}
