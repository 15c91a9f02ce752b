package com.ivyintel.tracker.scrape.extract;

import com.ivyintel.tracker.scrape.model.PageType;
import com.ivyintel.tracker.scrape.util.HtmlText;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

/**
 * Dispatches a document to the extractor for its page type. Every path returns a record; none throw on bad markup.
 */
@Component
public class ExtractorSuite {
    static final int PREVIEW_LENGTH = 2000;
    static final String PREVIEW_NOTE = "Unrecognized page type; showing a plain-text preview of the page.";

    private final FeesExtractor feesExtractor = new FeesExtractor();
    private final AdmissionsExtractor admissionsExtractor = new AdmissionsExtractor();
    private final DeadlinesExtractor deadlinesExtractor = new DeadlinesExtractor();
    private final ProgramsExtractor programsExtractor = new ProgramsExtractor();
    private final ParagraphSummaryExtractor paragraphExtractor = new ParagraphSummaryExtractor();

    public ExtractionRecord extract(PageType pageType, String html) {
        Document document = HtmlText.parse(html);
        if (pageType == null) {
            return preview(document);
        }
        return switch (pageType) {
            case FEES -> feesExtractor.extract(document);
            case ADMISSIONS -> admissionsExtractor.extract(document);
            case DEADLINES -> deadlinesExtractor.extract(document);
            case PROGRAMS -> programsExtractor.extract(document);
            case AID -> paragraphExtractor.extractAid(document);
            case ABOUT -> paragraphExtractor.extractAbout(document);
        };
    }

    /**
     * Raw-key variant; keys that do not name a {@link PageType} get the text preview.
     */
    public ExtractionRecord extract(String pageTypeKey, String html) {
        return extract(PageType.fromKey(pageTypeKey).orElse(null), html);
    }

    private TextPreviewRecord preview(Document document) {
        String text = HtmlText.visibleText(document);
        if (text.length() > PREVIEW_LENGTH) {
            int end = PREVIEW_LENGTH;
            // keep surrogate pairs whole
            if (Character.isHighSurrogate(text.charAt(end - 1))) {
                end--;
            }
            text = text.substring(0, end);
        }
        return new TextPreviewRecord(text, PREVIEW_NOTE);
    }
}
