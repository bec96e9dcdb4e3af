package com.contract.resolution.validation;

import com.contract.resolution.core.model.Document;
import com.contract.resolution.core.model.DocumentGroup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.contract.resolution.ContractFixtures.CONTRACT;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NamingConventions Tests")
class NamingConventionsTest {

    private static Document document(DocumentGroup group, int sequence, String name, String filename) {
        return Document.builder().id("doc").contractId(CONTRACT).group(group).sequence(sequence)
                .name(name).originalFilename(filename).build();
    }

    @ParameterizedTest
    @CsvSource({
            "D, 2, D2_Addendum_2.pdf",
            "C, 1, c1_General Conditions.pdf",
            "N, 10, N010_Schedule.docx"
    })
    @DisplayName("Conforming filenames should pass")
    void testConforming(String group, int sequence, String filename) {
        Document doc = document(DocumentGroup.fromCode(group), sequence, "Document", filename);

        assertNull(NamingConventions.filenameProblem(doc, filename));
    }

    @ParameterizedTest
    @CsvSource({
            "D, 2, addendum.pdf",
            "D, 2, C2_Addendum.pdf",
            "D, 2, D3_Addendum.pdf"
    })
    @DisplayName("Non-conforming filenames should be described")
    void testNonConforming(String group, int sequence, String filename) {
        Document doc = document(DocumentGroup.fromCode(group), sequence, "Document", filename);

        assertNotNull(NamingConventions.filenameProblem(doc, filename));
    }

    @Test
    @DisplayName("Should suggest a conforming filename keeping the extension")
    void testSuggestedFilename() {
        Document doc = document(DocumentGroup.D, 2, "Addendum No. 2 (Revised)", "scan.pdf");

        assertEquals("D2_Addendum_No_2_Revised.pdf", NamingConventions.suggestedFilename(doc, "scan.pdf"));

        List<ValidationIssue> issues = NamingConventions.check(doc);
        assertEquals(1, issues.size());
        assertTrue(issues.get(0).message().endsWith("suggested name: D2_Addendum_No_2_Revised.pdf"));
    }

    @Test
    @DisplayName("Should flag misfiled appendices and addendums")
    void testClassification() {
        List<ValidationIssue> appendix = NamingConventions.check(document(DocumentGroup.D, 1, "Appendix to Tender", null));
        List<ValidationIssue> addendum = NamingConventions.check(document(DocumentGroup.N, 1, "Addendum 4", null));
        List<ValidationIssue> fine = NamingConventions.check(document(DocumentGroup.N, 1, "Schedule of Rates", null));

        assertEquals(1, appendix.size());
        assertEquals(ErrorCode.NAMING_CONVENTION_VIOLATION, appendix.get(0).code());
        assertEquals("doc", appendix.get(0).documentId());
        assertEquals(1, addendum.size());
        assertTrue(fine.isEmpty());
    }
}
