package com.github.ytdle.service.fetch;

import com.github.ytdle.model.FetchOutcome;

/**
 * Performs one attempt of one job: transfer, merge and post-process.
 * <p>
 * Implementations block until the attempt ends and report it as a {@link FetchOutcome}; they never throw for an
 * expected failure. Teardown requested through the {@link FetchControl} must end the attempt promptly with
 * {@link FetchOutcome#interrupted()}.
 */
public interface FetchAdapter {

    FetchOutcome fetch(FetchContext context, FetchControl control, FetchListener listener);
}
