package eu.virtualparadox.flockqa.application.config;

import eu.virtualparadox.flockqa.rag.embed.EmbeddingMethod;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Root configuration of the retrieval core, bound from {@code flockqa.*}.
 * <p>
 * Every group carries its defaults in field initializers so that components can be
 * instantiated directly (tests, tools) without a Spring context.
 */
@Configuration
@ConfigurationProperties(prefix = "flockqa")
@Getter @Setter
public class ApplicationConfig {

    private Storage storage = new Storage();
    private Partitions partitions = new Partitions();
    private Embedding embedding = new Embedding();
    private Ranking ranking = new Ranking();
    private Retrieval retrieval = new Retrieval();
    private Answer answer = new Answer();

    /**
     * Where persisted partitions live and how they are read.
     */
    @Getter @Setter
    public static class Storage {
        /** Directory holding one subdirectory per partition. */
        private Path root;
        /** Explicit per-partition locations, highest precedence. */
        private Map<String, Path> overrides = new LinkedHashMap<>();
        /** Searched in order when neither an override nor the root applies. */
        private List<Path> fallbackPaths = new ArrayList<>(List.of(
                Path.of("backend", "rag_index"),
                Path.of("rag_index")));
        private String documentsFile = "documents.json";
        private String indexDirectory = "index";
        /** Rewrite non-canonical embedding labels in place on load. */
        private boolean selfHeal = true;
    }

    @Getter @Setter
    public static class Partitions {
        private List<String> domains = new ArrayList<>(List.of("broiler", "layer"));
        private String generic = "global";

        /**
         * @return domain partitions followed by the generic one, without duplicates
         */
        public List<String> all() {
            final Set<String> ordered = new LinkedHashSet<>(domains);
            ordered.add(generic);
            return List.copyOf(ordered);
        }
    }

    @Getter @Setter
    public static class Embedding {
        /** Method assumed for artifacts that carry no method label at all. */
        private EmbeddingMethod defaultMethod = EmbeddingMethod.NEURAL_ENCODER;
        private Neural neural = new Neural();
        private Remote remote = new Remote();
    }

    @Getter @Setter
    public static class Neural {
        /** Directory containing {@code model.onnx} and {@code tokenizer.json}. */
        private Path modelDir = Path.of("models", "encoder");
        private int maxTokens = 512;
        /** Zero means "all cores but one". */
        private int intraOpThreads = 0;
    }

    @Getter @Setter
    public static class Remote {
        private String apiKey;
        private String baseUrl = "https://api.openai.com";
        private String model = "text-embedding-3-small";
    }

    @Getter @Setter
    public static class Ranking {
        private double distanceDecay = 1.5;
        private double tableHeuristicBonus = 0.2;
        private double tableMetadataBonus = 0.15;
        private double technicalDomainBonus = 0.1;
        private double numericPatternBonus = 0.05;
        private double overlapCap = 0.15;
        private double perfTargetsBonus = 0.3;
        private Set<String> technicalDomains = new LinkedHashSet<>(List.of("performance", "nutrition"));
    }

    @Getter @Setter
    public static class Retrieval {
        private double highConfidence = 0.7;
        private double mediumConfidence = 0.3;
        private double wideSearchConfidence = 0.5;
        private int confidentWidthMultiplier = 3;
        private int defaultWidthMultiplier = 2;
        private int filteredWidthMultiplier = 4;
        private int minSearchWidth = 10;
        /** Overall budget for one request; zero or negative disables it. */
        private Duration requestDeadline = Duration.ofSeconds(30);
    }

    @Getter @Setter
    public static class Answer {
        private int maxCandidates = 5;
        private int maxPassageChars = 600;
    }
}
