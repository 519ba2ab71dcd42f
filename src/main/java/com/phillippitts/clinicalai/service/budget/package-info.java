/**
 * Per-organization spend control for metered backends.
 *
 * <p>Admission ({@code canSpend}) is checked before a metered call; usage is recorded afterwards
 * through the asynchronous {@link com.phillippitts.clinicalai.service.budget.UsageRecorder}, so
 * accounting never blocks or fails a generation.
 */
package com.phillippitts.clinicalai.service.budget;
