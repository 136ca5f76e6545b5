package com.citationchecker;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CitationStyleJUnitTest {

    @Test
    void fromName_ignoresCaseAndBlanks() {
        assertEquals(CitationStyle.APA, CitationStyle.fromName("apa"));
        assertEquals(CitationStyle.VANCOUVER, CitationStyle.fromName(" Vancouver "));
        assertEquals(CitationStyle.CHICAGO, CitationStyle.fromName("CHICAGO"));
    }

    @Test
    void fromName_rejectsUnknownStyles() {
        var e = assertThrows(IllegalArgumentException.class, () -> CitationStyle.fromName("harvard"));
        assertTrue(e.getMessage().contains("harvard"));
    }

    @Test
    void detect_commaPatternMeansApa() {
        assertEquals(CitationStyle.APA, CitationStyle.detect("Known (Smith, 2020) and (Jones, 2019)."));
    }

    @Test
    void detect_noCommaPatternMeansVancouver() {
        assertEquals(CitationStyle.VANCOUVER, CitationStyle.detect("Known (Smith 2020) and (Jones 2019)."));
    }

    @Test
    void detect_defaultsToApa() {
        assertEquals(CitationStyle.APA, CitationStyle.detect("No citations at all."));
        assertEquals(CitationStyle.APA, CitationStyle.detect((String) null));
    }

    @Test
    void detect_samplesOnlyLeadingParagraphs() {
        List<String> texts = new ArrayList<>();
        for (int i = 0; i < CitationStyle.DETECTION_SAMPLE_PARAGRAPHS; i++) {
            texts.add("Plain text " + i + ".");
        }
        texts.add("Late citation (Smith 2020).");

        assertEquals(CitationStyle.APA, CitationStyle.detect(Paragraph.of(texts)));
    }

    @Test
    void eachStyleHasAParser() {
        assertInstanceOf(ApaCitationParser.class, CitationStyle.APA.parser());
        assertInstanceOf(VancouverCitationParser.class, CitationStyle.VANCOUVER.parser());
        assertInstanceOf(ChicagoCitationParser.class, CitationStyle.CHICAGO.parser());
        assertEquals("Chicago (Author-Year)", CitationStyle.CHICAGO.displayName());
    }
}
