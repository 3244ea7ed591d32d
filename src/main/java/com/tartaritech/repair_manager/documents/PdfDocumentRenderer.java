package com.tartaritech.repair_manager.documents;

import java.io.ByteArrayOutputStream;
import java.util.List;

import org.springframework.stereotype.Component;

import com.lowagie.text.Document;
import com.lowagie.text.DocumentException;
import com.lowagie.text.Font;
import com.lowagie.text.FontFactory;
import com.lowagie.text.PageSize;
import com.lowagie.text.Paragraph;
import com.lowagie.text.Phrase;
import com.lowagie.text.pdf.PdfPCell;
import com.lowagie.text.pdf.PdfPTable;
import com.lowagie.text.pdf.PdfWriter;
import com.tartaritech.repair_manager.exceptions.DataStoreException;

/**
 * Renders a {@link DocumentContent} as a single-column US Letter PDF.
 */
@Component
public class PdfDocumentRenderer implements DocumentRenderer {

    private static final Font BUSINESS_FONT = FontFactory.getFont(FontFactory.HELVETICA_BOLD, 18);
    private static final Font TITLE_FONT = FontFactory.getFont(FontFactory.HELVETICA_BOLD, 14);
    private static final Font HEADING_FONT = FontFactory.getFont(FontFactory.HELVETICA_BOLD, 11);
    private static final Font NORMAL_FONT = FontFactory.getFont(FontFactory.HELVETICA, 10);

    @Override
    public byte[] render(DocumentContent content) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Document document = new Document(PageSize.LETTER, 54, 54, 54, 54);
        try {
            PdfWriter.getInstance(document, out);
            document.addTitle(content.getTitle());
            document.open();

            List<String> header = content.getHeaderLines();
            for (int i = 0; i < header.size(); i++) {
                document.add(new Paragraph(header.get(i), i == 0 ? BUSINESS_FONT : NORMAL_FONT));
            }

            Paragraph title = new Paragraph(content.getTitle(), TITLE_FONT);
            title.setSpacingBefore(12);
            title.setSpacingAfter(4);
            document.add(title);

            for (DocumentContent.Section section : content.getSections()) {
                Paragraph heading = new Paragraph(section.getHeading(), HEADING_FONT);
                heading.setSpacingBefore(8);
                document.add(heading);
                for (DocumentContent.Line line : section.getLines()) {
                    document.add(new Paragraph(line.getLabel() + ": " + line.getValue(), NORMAL_FONT));
                }
                for (String text : section.getParagraphs()) {
                    document.add(new Paragraph(text, NORMAL_FONT));
                }
            }

            if (content.getTable() != null) {
                addTable(document, content.getTable());
            }
        } catch (DocumentException e) {
            throw new DataStoreException("Failed to render document: " + content.getTitle(), e);
        } finally {
            if (document.isOpen()) {
                document.close();
            }
        }
        return out.toByteArray();
    }

    private void addTable(Document document, DocumentContent.Table table) throws DocumentException {
        Paragraph heading = new Paragraph(table.getHeading(), HEADING_FONT);
        heading.setSpacingBefore(8);
        heading.setSpacingAfter(4);
        document.add(heading);

        PdfPTable pdfTable = new PdfPTable(table.getColumns().size());
        pdfTable.setWidthPercentage(100);
        pdfTable.setHeaderRows(1);
        for (String column : table.getColumns()) {
            pdfTable.addCell(new PdfPCell(new Phrase(column, HEADING_FONT)));
        }
        for (List<String> row : table.getRows()) {
            for (int c = 0; c < table.getColumns().size(); c++) {
                String value = c < row.size() && row.get(c) != null ? row.get(c) : "";
                pdfTable.addCell(new PdfPCell(new Phrase(value, NORMAL_FONT)));
            }
        }
        if (table.getRows().isEmpty()) {
            PdfPCell empty = new PdfPCell(new Phrase("None", NORMAL_FONT));
            empty.setColspan(table.getColumns().size());
            pdfTable.addCell(empty);
        }
        document.add(pdfTable);
    }
}
