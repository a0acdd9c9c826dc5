package com.github.ytdle.service.engine;

import org.junit.jupiter.api.DisplayName;

@DisplayName("AsyncDownloadEngine")
class AsyncDownloadEngineTest extends DownloadEngineContract {

    @Override
    protected DownloadEngine createEngine(EngineComponents components) {
        return new AsyncDownloadEngine(components);
    }
}
