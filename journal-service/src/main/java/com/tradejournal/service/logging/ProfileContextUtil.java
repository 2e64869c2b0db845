package com.tradejournal.service.logging;

import org.slf4j.MDC;

/**
 * Bridges the profile id into MDC for the duration of a log statement.
 *
 * <p>Reactive pipelines hop threads, so MDC is never left populated: the key is
 * written, the log action runs, and the key is removed.
 * <pre>
 *     ProfileContextUtil.withMdc(profileId, () -> log.info("Trade logged. id={}", id));
 * </pre>
 */
public final class ProfileContextUtil {

    public static final String PROFILE_ID_KEY = "profileId";

    private ProfileContextUtil() {}

    public static void withMdc(String profileId, Runnable logAction) {
        MDC.put(PROFILE_ID_KEY, profileId);
        try {
            logAction.run();
        } finally {
            MDC.remove(PROFILE_ID_KEY);
        }
    }
}
