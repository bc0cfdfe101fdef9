package uk.gegc.examforge.features.paper.infra.pdf;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import uk.gegc.examforge.features.paper.application.DocumentRenderer;
import uk.gegc.examforge.features.paper.application.RenderedDocument;
import uk.gegc.examforge.features.paper.domain.model.Paper;
import uk.gegc.examforge.features.paper.domain.model.Question;
import uk.gegc.examforge.features.paper.domain.model.RenderVariant;
import uk.gegc.examforge.shared.config.ExamProperties;
import uk.gegc.examforge.shared.exception.RenderException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Renders a paper to PDF. The question paper lists
 * questions only; the answer key repeats each question followed by its answer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PdfBoxDocumentRenderer implements DocumentRenderer {

    private static final float MARGIN = 50f;
    private static final float PAGE_WIDTH = PDRectangle.A4.getWidth();
    private static final float MAX_TEXT_WIDTH = PAGE_WIDTH - (2 * MARGIN);
    private static final float TITLE_FONT_SIZE = 16f;
    private static final float HEADING_FONT_SIZE = 13f;
    private static final float NORMAL_FONT_SIZE = 11f;
    private static final float SMALL_FONT_SIZE = 10f;
    private static final float LINE_SPACING = 1.2f;
    private static final float QUESTION_SPACING = 12f;
    private static final float OPTION_INDENT = 20f;

    private static final DateTimeFormatter EXAM_DATE = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH);

    private static final List<String> INSTRUCTIONS = List.of(
            "Answer all questions.",
            "Each question carries marks as indicated.",
            "Write clearly and legibly.",
            "Use of calculators is permitted unless otherwise stated."
    );

    private final ExamProperties examProperties;

    @Override
    public RenderedDocument render(Paper paper, RenderVariant variant) {
        return new RenderedDocument(variant, filename(paper, variant), MediaType.APPLICATION_PDF_VALUE,
                renderPdf(paper, variant));
    }

    byte[] renderPdf(Paper paper, RenderVariant variant) {
        try (PDDocument document = new PDDocument()) {
            PDPageContext context = new PDPageContext(document);
            renderHeader(context, paper, variant);
            if (variant == RenderVariant.QUESTIONS_ONLY) {
                renderInstructions(context);
            }

            context.gap(QUESTION_SPACING);
            context.writeText(variant == RenderVariant.WITH_ANSWERS ? "ANSWER KEY" : "QUESTIONS",
                    PDType1Font.HELVETICA_BOLD, HEADING_FONT_SIZE, 0);
            context.gap(QUESTION_SPACING / 2);

            List<Question> questions = paper.getQuestions();
            for (int i = 0; i < questions.size(); i++) {
                renderQuestion(context, i + 1, questions.get(i), variant);
            }

            context.close();
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            log.debug("Rendered {} PDF for paper {} ({} bytes)", variant, paper.getId(), out.size());
            return out.toByteArray();
        } catch (IOException | RuntimeException e) {
            throw new RenderException("Failed to render " + variant + " PDF for paper " + paper.getId(), e);
        }
    }

    private void renderHeader(PDPageContext context, Paper paper, RenderVariant variant) throws IOException {
        context.writeText(examProperties.getRender().getInstitutionHeading(), PDType1Font.HELVETICA_BOLD, TITLE_FONT_SIZE, 0);
        context.writeText("Department of " + paper.getDepartment(), PDType1Font.HELVETICA, NORMAL_FONT_SIZE, 0);
        context.writeText(paper.getSubject() + (variant == RenderVariant.WITH_ANSWERS ? " - Answer Key" : ""),
                PDType1Font.HELVETICA_BOLD, NORMAL_FONT_SIZE, 0);
        if (paper.getSection() != null && !paper.getSection().isBlank()) {
            context.writeText("Section: " + paper.getSection(), PDType1Font.HELVETICA, NORMAL_FONT_SIZE, 0);
        }
        if (paper.getYear() != null) {
            context.writeText("Year: " + paper.getYear(), PDType1Font.HELVETICA, NORMAL_FONT_SIZE, 0);
        }
        if (paper.getExamDate() != null) {
            context.writeText("Date: " + EXAM_DATE.format(paper.getExamDate()), PDType1Font.HELVETICA, NORMAL_FONT_SIZE, 0);
        }
        context.writeText("Exam: " + paper.getExamType() + "    Total Marks: " + paper.getTotalMarks(),
                PDType1Font.HELVETICA, NORMAL_FONT_SIZE, 0);
    }

    private void renderInstructions(PDPageContext context) throws IOException {
        context.gap(QUESTION_SPACING);
        context.writeText("Instructions:", PDType1Font.HELVETICA_BOLD, NORMAL_FONT_SIZE, 0);
        for (String instruction : INSTRUCTIONS) {
            context.writeText("- " + instruction, PDType1Font.HELVETICA, SMALL_FONT_SIZE, OPTION_INDENT);
        }
    }

    private void renderQuestion(PDPageContext context, int number, Question question, RenderVariant variant) throws IOException {
        context.ensureSpace(NORMAL_FONT_SIZE * LINE_SPACING * 3);
        String header = "Q" + number + ". [" + question.marks() + " marks] ["
                + question.cognitiveLevel().getDisplayName() + "] [" + question.category().getDisplayName() + "]";
        context.writeText(header, PDType1Font.HELVETICA_BOLD, NORMAL_FONT_SIZE, 0);

        for (String line : question.text().split("\\R")) {
            context.writeText(line, PDType1Font.HELVETICA, NORMAL_FONT_SIZE, 0);
        }
        for (String option : question.options()) {
            context.writeText(option, PDType1Font.HELVETICA, SMALL_FONT_SIZE, OPTION_INDENT);
        }

        if (variant == RenderVariant.WITH_ANSWERS) {
            String answer = question.answerKey() == null || question.answerKey().isBlank()
                    ? "(no answer provided)" : question.answerKey();
            context.writeText("Answer: " + answer, PDType1Font.HELVETICA_OBLIQUE, SMALL_FONT_SIZE, OPTION_INDENT);
            if (question.explanation() != null && !question.explanation().isBlank()) {
                context.writeText("Note: " + question.explanation(), PDType1Font.HELVETICA, SMALL_FONT_SIZE, OPTION_INDENT);
            }
        }
        context.gap(QUESTION_SPACING);
    }

    static String filename(Paper paper, RenderVariant variant) {
        String base = paper.getSubject() == null ? "paper" : paper.getSubject().replaceAll("[^A-Za-z0-9]+", "_");
        String suffix = variant == RenderVariant.WITH_ANSWERS ? "answer_key" : "question_paper";
        return base + "_" + suffix + ".pdf";
    }

    /**
     * Replaces characters the standard Type 1 fonts cannot encode. The text comes from a model and
     * may hold any Unicode.
     */
    static String toEncodable(String text, PDFont font) {
        StringBuilder safe = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> {
            String ch = new String(Character.toChars(cp));
            if (Character.isISOControl(cp)) {
                safe.append(' ');
                return;
            }
            try {
                font.encode(ch);
                safe.append(ch);
            } catch (IOException | IllegalArgumentException e) {
                safe.append('?');
            }
        });
        return safe.toString();
    }

    private static class PDPageContext {
        private final PDDocument document;
        private PDPageContentStream contentStream;
        private float y;
        private final float pageHeight = PDRectangle.A4.getHeight();

        PDPageContext(PDDocument document) {
            this.document = document;
        }

        void startNewPage() throws IOException {
            if (contentStream != null) {
                contentStream.close();
            }
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);
            contentStream = new PDPageContentStream(document, page);
            y = pageHeight - MARGIN;
        }

        void ensureSpace(float requiredSpace) throws IOException {
            if (contentStream == null || y < MARGIN + requiredSpace) {
                startNewPage();
            }
        }

        void gap(float space) {
            y -= space;
        }

        /**
         * Writes text wrapped to the page width, starting {@code indent} points in from the margin.
         */
        void writeText(String text, PDFont font, float fontSize, float indent) throws IOException {
            if (text == null || text.isBlank()) {
                return;
            }
            float maxWidth = MAX_TEXT_WIDTH - indent;
            StringBuilder line = new StringBuilder();
            for (String word : toEncodable(text, font).split("\\s+")) {
                String candidate = line.length() == 0 ? word : line + " " + word;
                if (font.getStringWidth(candidate) / 1000 * fontSize > maxWidth && line.length() > 0) {
                    writeSingleLine(line.toString(), font, fontSize, indent);
                    line = new StringBuilder(word);
                } else {
                    line = new StringBuilder(candidate);
                }
            }
            if (line.length() > 0) {
                writeSingleLine(line.toString(), font, fontSize, indent);
            }
        }

        private void writeSingleLine(String text, PDFont font, float fontSize, float indent) throws IOException {
            ensureSpace(fontSize * LINE_SPACING);
            contentStream.beginText();
            contentStream.setFont(font, fontSize);
            contentStream.newLineAtOffset(MARGIN + indent, y);
            contentStream.showText(text);
            contentStream.endText();
            y -= fontSize * LINE_SPACING;
        }

        void close() throws IOException {
            if (contentStream != null) {
                contentStream.close();
            }
        }
    }
}
