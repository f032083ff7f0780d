package com.voltscope.service.core.config;

import com.voltscope.sampling.AdaptivePolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "voltscope.sampling")
@Getter
@Setter
public class SamplingProperties {
    /** Series longer than this are downsampled. */
    private int threshold = AdaptivePolicy.DEFAULT_THRESHOLD;

    /** Number of points a downsampled series is reduced to. */
    private int targetPoints = AdaptivePolicy.DEFAULT_TARGET_POINTS;

    /** x field used when a request names none; inferred from the data when unset. */
    private String defaultXKey;

    /** y field used when a request names none; inferred from the data when unset. */
    private String defaultYKey;

    public AdaptivePolicy toPolicy() {
        return new AdaptivePolicy(threshold, targetPoints);
    }
}
