package uk.gegc.questionbank.features.aggregate.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for aggregate storage, sampling and repair.
 */
@Getter
@Setter
@Validated
@Component
@ConfigurationProperties(prefix = "questionbank.aggregates")
public class AggregateProperties {

    @NotNull
    private Storage storage = Storage.JPA;

    @Valid
    private Sampling sampling = new Sampling();

    @Valid
    private Repair repair = new Repair();

    public enum Storage {
        JPA,
        MEMORY
    }

    @Getter
    @Setter
    public static class Sampling {

        /**
         * Draws allowed per requested slot before the slot is given up.
         */
        @Min(1)
        private int maxAttemptsPerSlot = 20;

        /**
         * Upper bound on sequential ranks visited when rejection sampling falls short.
         */
        @Min(0)
        private int sweepLimit = 500;

        @Min(1)
        private long timeoutSeconds = 10;
    }

    @Getter
    @Setter
    public static class Repair {

        @Min(1)
        @Max(500)
        private int pageSize = 100;

        @Min(1)
        @Max(1000)
        private int clearBatchSize = 100;

        @Min(1)
        private int maxRecordedMismatches = 50;

        @Min(1)
        private int pageRetries = 3;

        private boolean resumeOnStartup = true;

        private boolean rebuildMemoryIndexOnStartup = true;
    }
}
