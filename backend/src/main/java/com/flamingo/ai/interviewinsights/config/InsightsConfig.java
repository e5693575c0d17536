package com.flamingo.ai.interviewinsights.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the insights engine. */
@Configuration
@ConfigurationProperties(prefix = "insights")
@Validated
@Getter
@Setter
public class InsightsConfig {

  @Valid private Taxonomy taxonomy = new Taxonomy();
  @Valid private Normalization normalization = new Normalization();
  @Valid private Extraction extraction = new Extraction();
  @Valid private Scoring scoring = new Scoring();
  @Valid private Priority priority = new Priority();
  @Valid private Trend trend = new Trend();
  @Valid private Recommendation recommendation = new Recommendation();
  @Valid private Async async = new Async();

  @Getter
  @Setter
  public static class Taxonomy {
    /** Spring resource location of the taxonomy YAML file. */
    @NotBlank private String location = "classpath:taxonomy.yml";
  }

  @Getter
  @Setter
  public static class Normalization {
    @Min(1)
    private int minTokenLength = 2;

    /** Longer tokens are treated as malformed (base64 blobs, URLs that escaped stripping). */
    @Min(8)
    private int maxTokenLength = 64;

    /** Terms kept even when they are stopwords or shorter than the minimum length. */
    private List<String> extraWhitelist = new ArrayList<>();

    private List<String> extraStopwords = new ArrayList<>();
  }

  @Getter
  @Setter
  public static class Extraction {
    /** Documents per aggregation batch. */
    @Min(1)
    private int batchSize = 50;

    /** Whether terms outside the taxonomy may become topics (category OTHER). */
    private boolean includeUncategorizedTerms = false;

    /** Minimum documents an uncategorized term must appear in. */
    @Min(1)
    private int minDocumentFrequency = 2;

    /** Merge terms sharing a light suffix-stripped stem. */
    private boolean stemMerging = true;

    /** Jaccard similarity of document sets at or above which two terms are merged. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double cooccurrenceThreshold = 0.8;

    /** Minimum documents each term needs before co-occurrence merging applies. */
    @Min(1)
    private int minCooccurrenceDocuments = 3;

    @Min(1)
    private int maxTopics = 50;
  }

  @Getter
  @Setter
  public static class Scoring {
    @Valid private Decay decay = new Decay();
    @Valid private Difficulty difficulty = new Difficulty();
    @Valid private Confidence confidence = new Confidence();

    @Getter
    @Setter
    public static class Decay {
      /** Age in days at which a document's weight halves (about two years). */
      @DecimalMin("1.0")
      private double halfLifeDays = 730.0;

      /** Floor for the decay weight so very old documents still count a little. */
      @DecimalMin("0.0")
      @DecimalMax("1.0")
      private double minWeight = 0.01;
    }

    @Getter
    @Setter
    public static class Difficulty {
      private double keywordWeight = 0.40;
      private double roundWeight = 0.25;
      private double depthWeight = 0.25;
      private double outcomeWeight = 0.10;

      /** Number of rounds at which the round-count proxy saturates. */
      @Min(1)
      private int saturationRounds = 5;

      /** Distinct taxonomy terms per document at which the depth proxy saturates. */
      @Min(1)
      private int depthSaturationTerms = 8;
    }

    @Getter
    @Setter
    public static class Confidence {
      /** Below this many contributing documents confidence is forced to zero. */
      @Min(2)
      private int minSampleSize = 3;
    }
  }

  @Getter
  @Setter
  public static class Priority {
    /** Normalized weighted frequency for HIGH. */
    private double highThreshold = 0.66;

    /** Normalized weighted frequency for MEDIUM. */
    private double mediumThreshold = 0.33;

    /** Confidence required for HIGH. */
    private double minHighConfidence = 0.5;
  }

  @Getter
  @Setter
  public static class Trend {
    @Min(1)
    private int bucketMonths = 3;

    /** Shorter series are reported as STABLE without testing. */
    @Min(3)
    private int minBuckets = 4;

    private double significanceLevel = 0.05;

    /** Kendall tau magnitude below which the direction is STABLE. */
    private double minStrength = 0.1;
  }

  @Getter
  @Setter
  public static class Recommendation {
    private double frequencyWeight = 0.4;
    private double difficultyWeight = 0.3;
    private double successWeight = 0.2;
    private double trendWeight = 0.1;

    /** Confidence below which recommendations carry a small-sample caveat. */
    private double lowConfidenceThreshold = 0.3;

    @Valid private StudyHours studyHours = new StudyHours();

    /** Study-hours curve: base + difficultyHours * difficulty^exponent + breadth term, capped. */
    @Getter
    @Setter
    public static class StudyHours {
      @DecimalMin("0.0")
      private double baseHours = 4.0;

      @DecimalMin("0.0")
      private double difficultyHours = 16.0;

      @DecimalMin("0.1")
      private double difficultyExponent = 1.5;

      @DecimalMin("0.0")
      private double hoursPerExtraTerm = 1.5;

      @DecimalMin("0.5")
      private double maxHours = 40.0;
    }
  }

  @Getter
  @Setter
  public static class Async {
    @Min(1)
    private int corePoolSize = 2;

    @Min(1)
    private int maxPoolSize = 4;

    @Min(0)
    private int queueCapacity = 100;
  }
}
