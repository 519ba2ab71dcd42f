package com.phillippitts.clinicalai.testutil;

import java.util.concurrent.Executor;

/**
 * Runs tasks on the calling thread so fan-out tests are deterministic.
 */
public class SyncExecutor implements Executor {
    @Override
    public void execute(Runnable command) {
        command.run();
    }
}
