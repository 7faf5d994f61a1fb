package com.eyelevel.jobrelay.layout;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Mints job and session identifiers.
 * <p>
 * Job identifiers keep the second-resolution timestamp workers and operators sort by, followed by a
 * random suffix so that two submissions in the same second never share a status record.
 */
@Component
public class JobIdGenerator {

    private static final DateTimeFormatter JOB_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int SUFFIX_BYTES = 3;
    private static final int SESSION_ID_LENGTH = 8;

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public JobIdGenerator(final Clock clock) {
        this.clock = clock;
    }

    /**
     * @return An identifier of the form {@code job_YYYYMMDD_HHMMSS_xxxxxx}.
     */
    public String newJobId() {
        final byte[] suffix = new byte[SUFFIX_BYTES];
        random.nextBytes(suffix);
        return "job_" + LocalDateTime.now(clock).format(JOB_TIMESTAMP) + "_" + HexFormat.of().formatHex(suffix);
    }

    /**
     * @return Eight lowercase hex characters.
     */
    public String newSessionId() {
        return UUID.randomUUID().toString().substring(0, SESSION_ID_LENGTH);
    }
}
