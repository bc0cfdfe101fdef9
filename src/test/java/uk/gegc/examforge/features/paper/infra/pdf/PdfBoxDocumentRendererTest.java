package uk.gegc.examforge.features.paper.infra.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.examforge.BaseUnitTest;
import uk.gegc.examforge.features.paper.application.RenderedDocument;
import uk.gegc.examforge.features.paper.domain.model.Paper;
import uk.gegc.examforge.features.paper.domain.model.Question;
import uk.gegc.examforge.features.paper.domain.model.RenderVariant;
import uk.gegc.examforge.shared.config.ExamProperties;
import uk.gegc.examforge.support.TestPapers;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PdfBoxDocumentRendererTest extends BaseUnitTest {

    private PdfBoxDocumentRenderer renderer;
    private Paper paper;

    @BeforeEach
    void setUp() {
        renderer = new PdfBoxDocumentRenderer(new ExamProperties());
        paper = TestPapers.draft();
    }

    private static String textOf(byte[] pdf) throws Exception {
        try (PDDocument document = PDDocument.load(pdf)) {
            return new PDFTextStripper().getText(document);
        }
    }

    @Test
    @DisplayName("renderPdf: question paper has instructions and no answers")
    void renderPdf_questionsOnly() throws Exception {
        byte[] pdf = renderer.renderPdf(paper, RenderVariant.QUESTIONS_ONLY);

        assertThat(new String(pdf, 0, 4, StandardCharsets.US_ASCII)).isEqualTo("%PDF");
        String text = textOf(pdf);
        assertThat(text).contains("UNIVERSITY EXAMINATION", "Department of Science", "Instructions:",
                "QUESTIONS", "Q1. [1 marks]", "Total Marks: 4");
        assertThat(text).doesNotContain("Answer:");
    }

    @Test
    @DisplayName("renderPdf: answer key lists each answer and skips instructions")
    void renderPdf_withAnswers() throws Exception {
        String text = textOf(renderer.renderPdf(paper, RenderVariant.WITH_ANSWERS));

        assertThat(text).contains("Physics - Answer Key", "ANSWER KEY", "Answer: Answer", "Note: Because");
        assertThat(text).doesNotContain("Instructions:");
    }

    @Test
    @DisplayName("renderPdf: long papers with unencodable characters spill onto more pages")
    void renderPdf_manyQuestions_multiplePages() throws Exception {
        List<Question> questions = new ArrayList<>(paper.getQuestions());
        for (int i = 0; i < 60; i++) {
            questions.add(TestPapers.questions().get(2));
        }
        questions.set(0, new Question("Compute ∫ x dx → π\tnow",
                "x²/2", null, questions.get(0).category(), questions.get(0).cognitiveLevel(), 1,
                questions.get(0).provenance(), null, null, null));
        paper.setQuestions(questions);

        byte[] pdf = renderer.renderPdf(paper, RenderVariant.WITH_ANSWERS);

        try (PDDocument document = PDDocument.load(pdf)) {
            assertThat(document.getNumberOfPages()).isGreaterThan(1);
        }
    }

    @Test
    @DisplayName("render: returns the PDF with its download name")
    void render_returnsDocument() {
        RenderedDocument document = renderer.render(paper, RenderVariant.QUESTIONS_ONLY);

        assertThat(document.variant()).isEqualTo(RenderVariant.QUESTIONS_ONLY);
        assertThat(document.filename()).isEqualTo("Physics_question_paper.pdf");
        assertThat(document.contentType()).isEqualTo("application/pdf");
        assertThat(new String(document.content(), 0, 4, StandardCharsets.US_ASCII)).isEqualTo("%PDF");
    }

    @Test
    void toEncodable_replacesUnsupportedCharacters() {
        assertThat(PdfBoxDocumentRenderer.toEncodable("aπb\tc", PDType1Font.HELVETICA)).isEqualTo("a?b c");
    }

    @Test
    void filename_sanitizesSubject() {
        paper.setSubject("Data Structures & Algorithms");

        assertThat(PdfBoxDocumentRenderer.filename(paper, RenderVariant.WITH_ANSWERS))
                .isEqualTo("Data_Structures_Algorithms_answer_key.pdf");
    }
}
