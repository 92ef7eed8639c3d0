package eu.virtualparadox.flockqa.rag.answer;

import eu.virtualparadox.flockqa.application.config.ApplicationConfig;
import eu.virtualparadox.flockqa.rag.partition.model.DocumentRecord;
import eu.virtualparadox.flockqa.rag.rerank.model.RankedResult;
import eu.virtualparadox.flockqa.rag.rerank.service.QueryFeatures;
import eu.virtualparadox.flockqa.rag.rerank.service.StructuredContentDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Composes a readable answer from ranked passages, without a language model.
 * <p>
 * Layout:
 * <pre>
 * Technical data found:            (or "Relevant information:")
 *
 * **Source: guide.pdf (Species: broiler, Line: Ross 308)**
 * [Table - Age: 0-42 days]
 * passage text, truncated...
 *
 * ---
 *
 * **Source: ...**
 * </pre>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnswerSynthesizer {

    public static final String NO_RESULTS = "No relevant information found in the knowledge base.";
    public static final String TECHNICAL_HEADER = "Technical data found:";
    public static final String GENERAL_HEADER = "Relevant information:";
    public static final String UNKNOWN_SOURCE = "unknown source";

    static final String SEPARATOR = "\n\n---\n\n";
    static final String ELLIPSIS = "...";

    private static final int MAX_TABULAR = 2;
    private static final int MAX_NARRATIVE = 1;
    private static final int MAX_COMBINED = 3;

    private static final List<String> SOURCE_KEYS = List.of("source", "file_path", "source_file");

    private final ApplicationConfig config;

    /**
     * @param query   user query
     * @param results ranked results, best first
     * @return the formatted answer; never null
     */
    public String synthesize(final String query, final List<RankedResult> results) {
        if (results == null || results.isEmpty()) {
            return NO_RESULTS;
        }

        try {
            final ApplicationConfig.Answer answer = config.getAnswer();
            final boolean technical = QueryFeatures.isTechnical(query);

            final List<DocumentRecord> tabular = new ArrayList<>();
            final List<DocumentRecord> narrative = new ArrayList<>();
            for (final RankedResult r : results.subList(0, Math.min(answer.getMaxCandidates(), results.size()))) {
                if (StructuredContentDetector.looksLikeTable(r.document())) {
                    tabular.add(r.document());
                } else {
                    narrative.add(r.document());
                }
            }

            final List<DocumentRecord> primary = new ArrayList<>();
            if (technical && !tabular.isEmpty()) {
                primary.addAll(tabular.subList(0, Math.min(MAX_TABULAR, tabular.size())));
                primary.addAll(narrative.subList(0, Math.min(MAX_NARRATIVE, narrative.size())));
            } else {
                primary.addAll(tabular);
                primary.addAll(narrative);
                if (primary.size() > MAX_COMBINED) {
                    primary.subList(MAX_COMBINED, primary.size()).clear();
                }
            }

            final List<String> parts = new ArrayList<>(primary.size());
            for (final DocumentRecord doc : primary) {
                parts.add(section(doc, answer.getMaxPassageChars()));
            }

            final String header = technical ? TECHNICAL_HEADER : GENERAL_HEADER;
            return header + "\n\n" + String.join(SEPARATOR, parts);
        } catch (RuntimeException e) {
            log.error("Answer synthesis failed", e);
            return results.size() + " relevant documents found but synthesis failed";
        }
    }

    private static String section(final DocumentRecord doc, final int maxChars) {
        String content = doc.content();
        if (content.length() > maxChars) {
            content = StringUtils.left(content, maxChars) + ELLIPSIS;
        }

        final String context = contextTags(doc);
        if (!context.isEmpty()) {
            content = "[" + context + "]\n" + content;
        }
        return "**Source: " + sourceLabel(doc) + "**\n" + content;
    }

    /**
     * File name of the first available source field, followed by known descriptors.
     */
    static String sourceLabel(final DocumentRecord doc) {
        String source = UNKNOWN_SOURCE;
        for (final String key : SOURCE_KEYS) {
            final String value = doc.metadataString(key);
            if (value != null) {
                source = value;
                break;
            }
        }
        final int lastSeparator = Math.max(source.lastIndexOf('/'), source.lastIndexOf('\\'));
        if (lastSeparator >= 0) {
            source = source.substring(lastSeparator + 1);
        }

        final List<String> descriptors = new ArrayList<>();
        addDescriptor(descriptors, "Species", doc.metadataString("species"));
        addDescriptor(descriptors, "Line", doc.metadataString("line"));
        addDescriptor(descriptors, "Sex", doc.metadataString("sex"));
        addDescriptor(descriptors, "Type", doc.metadataString("document_type"));

        return descriptors.isEmpty() ? source : source + " (" + String.join(", ", descriptors) + ")";
    }

    static String contextTags(final DocumentRecord doc) {
        final List<String> tags = new ArrayList<>();
        if (StructuredContentDetector.isTableChunk(doc)) {
            tags.add("Table");
        }
        if ("perf_targets".equals(doc.metadataString(StructuredContentDetector.KEY_TABLE_TYPE))) {
            tags.add("Performance targets");
        }
        final String ageRange = doc.metadataString("age_range");
        if (ageRange != null) {
            tags.add("Age: " + ageRange);
        }
        if ("advanced".equals(doc.metadataString("technical_level"))) {
            tags.add("Advanced level");
        }
        return String.join(" - ", tags);
    }

    private static void addDescriptor(final List<String> descriptors, final String label, final String value) {
        if (value != null) {
            descriptors.add(label + ": " + value);
        }
    }
}
