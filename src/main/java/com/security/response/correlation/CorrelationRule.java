package com.security.response.correlation;

import com.security.response.domain.RawAlert;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * One (condition, weight) entry of the correlator's rule table. The matcher returns the alerts
 * that satisfy the condition; an empty list means the rule did not fire.
 */
@Value
class CorrelationRule {

    String name;
    BigDecimal weight;
    /** Null for rules evaluated from other rules' results (time correlation). */
    Function<List<RawAlert>, List<RawAlert>> matcher;
    /** Indicator rules feed the time-correlation window; corroborating rules do not. */
    boolean indicator;

    static CorrelationRule indicator(String name, String weight, Predicate<RawAlert> predicate) {
        return new CorrelationRule(name, new BigDecimal(weight),
                alerts -> alerts.stream().filter(predicate).collect(Collectors.toList()), true);
    }

    static CorrelationRule corroborating(String name, String weight, Function<List<RawAlert>, List<RawAlert>> matcher) {
        return new CorrelationRule(name, new BigDecimal(weight), matcher, false);
    }
}
