package io.leadscore.engine.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Map;

/**
 * Lead scoring configuration.
 *
 * Weights are percentages per dimension and must add up to 100. The defaults favour
 * zip and service; a different scoring policy only needs different properties.
 */
@ConfigMapping(prefix = "leadscore")
public interface LeadScoringConfig {

    Weights weights();

    /**
     * Zone used to turn timestamped lead dates into calendar months, and to decide "today" for the sync.
     */
    @WithDefault("UTC")
    String timezone();

    Sync sync();

    ConversionEvents conversionEvents();

    interface Weights {
        @WithDefault("30")
        double service();

        @WithDefault("10")
        double adSetName();

        @WithDefault("10")
        double adName();

        @WithDefault("0")
        double leadDate();

        @WithDefault("50")
        double zip();
    }

    interface Sync {
        /**
         * Master switch for the scheduled fleet-wide sync. Manual triggers ignore it.
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Quartz-style cron of the scheduled sync, read by the scheduler as {leadscore.sync.cron}.
         */
        @WithDefault("0 0 2 ? * SUN")
        String cron();
    }

    interface ConversionEvents {
        @WithDefault("true")
        boolean enabled();

        @WithDefault("v21.0")
        String apiVersion();

        @WithDefault("leadscore")
        String leadEventSource();

        /**
         * Pixel credentials keyed by clientId. Clients without an entry get no conversion events.
         */
        Map<String, Pixel> clients();

        interface Pixel {
            String pixelId();

            String pixelToken();
        }
    }
}
