package com.meltwater.amq;

/**
 * Gets notified about {@link Advisory advisories}. Implementations must not throw.
 */
public interface AdvisoryListener {

    void onAdvisory(Advisory advisory);
}
