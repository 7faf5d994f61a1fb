package com.eyelevel.jobrelay.service.registry;

import com.eyelevel.jobrelay.model.BatchResult;
import com.eyelevel.jobrelay.model.JobStatus;
import com.eyelevel.jobrelay.model.JobStatusView;
import com.eyelevel.jobrelay.model.LookupResult;
import com.eyelevel.jobrelay.service.status.StatusTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves an identifier a user pasted in without saying what it is. Job identifiers are tried
 * first, then session identifiers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LookupService {

    private final StatusTracker statusTracker;
    private final SessionRegistry sessionRegistry;

    public LookupResult lookup(final String toolId, final String id) {
        final String trimmed = id.trim();
        final JobStatusView job = statusTracker.getStatus(toolId, trimmed);
        if (job.status() != JobStatus.NOT_FOUND) {
            return LookupResult.ofJob(job);
        }
        return sessionRegistry.find(toolId, trimmed)
                              .map(entry -> LookupResult.ofSession(BatchResult.from(entry)))
                              .orElseGet(() -> {
                                  log.info("Identifier '{}' matches no job or session of tool '{}'.", trimmed,
                                           toolId);
                                  return LookupResult.notFound(trimmed);
                              });
    }
}
