package com.eyelevel.jobrelay.service.poll;

import com.eyelevel.jobrelay.model.BatchProgress;

/**
 * Receives a progress snapshot after every ledger read while a batch is being watched.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = progress -> { };

    void onProgress(BatchProgress progress);
}
