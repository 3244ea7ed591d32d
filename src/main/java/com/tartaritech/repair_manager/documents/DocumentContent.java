package com.tartaritech.repair_manager.documents;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Layout-free description of a printable document: business header, title, sections of labelled lines and
 * paragraphs, and an optional table.
 */
@Getter
public class DocumentContent {

    private final String title;
    private final List<String> headerLines = new ArrayList<>();
    private final List<Section> sections = new ArrayList<>();
    private Table table;

    public DocumentContent(String title) {
        this.title = title;
    }

    public DocumentContent header(String line) {
        if (line != null && !line.isBlank()) {
            headerLines.add(line);
        }
        return this;
    }

    public Section section(String heading) {
        Section section = new Section(heading);
        sections.add(section);
        return section;
    }

    public DocumentContent table(String heading, List<String> columns, List<List<String>> rows) {
        this.table = new Table(heading, List.copyOf(columns), rows);
        return this;
    }

    public Section findSection(String heading) {
        return sections.stream()
                .filter(s -> s.getHeading().equals(heading))
                .findFirst()
                .orElse(null);
    }

    @Getter
    public static class Section {
        private final String heading;
        private final List<Line> lines = new ArrayList<>();
        private final List<String> paragraphs = new ArrayList<>();

        Section(String heading) {
            this.heading = heading;
        }

        public Section line(String label, Object value) {
            lines.add(new Line(label, value == null ? "" : value.toString()));
            return this;
        }

        public Section paragraph(String text) {
            if (text != null && !text.isBlank()) {
                paragraphs.add(text);
            }
            return this;
        }

        public String valueOf(String label) {
            return lines.stream()
                    .filter(l -> l.getLabel().equals(label))
                    .map(Line::getValue)
                    .findFirst()
                    .orElse(null);
        }
    }

    @Getter
    @AllArgsConstructor
    public static class Line {
        private final String label;
        private final String value;
    }

    @Getter
    @AllArgsConstructor
    public static class Table {
        private final String heading;
        private final List<String> columns;
        private final List<List<String>> rows;
    }
}
