package com.example.word2xml.util.structure.dto;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 参考文献条目
 *
 * 每个参考文献段落创建一次，创建后不再修改。分类由字段推导：
 * 有 url 为 web；有 issue 或 article-title 为 article；有 chapter-title 或 publisher 为 book；否则 other
 */
public class BibliographyEntry {

    /**
     * 可选字段
     */
    public enum Field {
        YEAR, CHAPTER_TITLE, SOURCE, ARTICLE_TITLE, VOLUME, ISSUE, FPAGE, LPAGE, PUBLISHER, PUBLISHER_LOC, URL, DOI
    }

    private final String id;
    private final List<PersonName> authors;
    private final Map<Field, String> fields;
    private final String matchText;

    public BibliographyEntry(String id, List<PersonName> authors, Map<Field, String> fields, String matchText) {
        this.id = id;
        this.authors = Collections.unmodifiableList(authors);
        Map<Field, String> copy = new EnumMap<>(Field.class);
        copy.putAll(fields);
        this.fields = Collections.unmodifiableMap(copy);
        this.matchText = matchText;
    }

    public String getId() { return id; }

    /** 作者（按出现顺序） */
    public List<PersonName> getAuthors() { return authors; }

    public Map<Field, String> getFields() { return fields; }

    public String field(Field field) { return fields.get(field); }

    public boolean has(Field field) {
        String value = fields.get(field);
        return value != null && !value.trim().isEmpty();
    }

    /** 归一化匹配键（整条文献文本） */
    public String getMatchText() { return matchText; }

    public PublicationType getPublicationType() {
        if (has(Field.URL)) {
            return PublicationType.WEB;
        }
        if (has(Field.ISSUE) || has(Field.ARTICLE_TITLE)) {
            return PublicationType.ARTICLE;
        }
        if (has(Field.CHAPTER_TITLE) || has(Field.PUBLISHER) || has(Field.PUBLISHER_LOC)) {
            return PublicationType.BOOK;
        }
        return PublicationType.OTHER;
    }

    /**
     * 作者姓名（姓 / 名）；机构作者只有 surname 为空、collab 有值
     */
    public static class PersonName {
        private final String surname;
        private final String givenNames;
        private final String collab;

        public PersonName(String surname, String givenNames, String collab) {
            this.surname = surname;
            this.givenNames = givenNames;
            this.collab = collab;
        }

        public String getSurname() { return surname; }
        public String getGivenNames() { return givenNames; }
        public String getCollab() { return collab; }

        @Override
        public String toString() {
            return collab != null ? collab : surname + ", " + givenNames;
        }
    }
}
