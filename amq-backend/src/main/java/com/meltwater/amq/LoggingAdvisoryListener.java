package com.meltwater.amq;

import com.meltwater.amq.util.Logger;

public class LoggingAdvisoryListener implements AdvisoryListener {

    private static final Logger log = new Logger(LoggingAdvisoryListener.class);

    @Override
    public void onAdvisory(Advisory advisory) {
        log.warnWithParams(advisory.description,
                "type", advisory.type,
                "subject", advisory.subject);
    }
}
