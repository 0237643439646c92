package com.tracegate.core.gate;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "tracegate.gate")
public class GateProperties {

    /** Minimum pass rate, in percent, over pass and fail results. */
    private double passRateThreshold = 95.0;

    /** Minimum share, in percent, of executions that are no longer not-run. */
    private double completionThreshold = 95.0;

    public double getPassRateThreshold() {
        return passRateThreshold;
    }

    public void setPassRateThreshold(double passRateThreshold) {
        this.passRateThreshold = passRateThreshold;
    }

    public double getCompletionThreshold() {
        return completionThreshold;
    }

    public void setCompletionThreshold(double completionThreshold) {
        this.completionThreshold = completionThreshold;
    }
}
