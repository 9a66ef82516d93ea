package it.aw.normativerag.config;

import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;

class LangChain4jConfigTest {

    @Test
    void tierSearchExecutorRunsAllFourTierQueriesTogether() {
        ExecutorService executor = new LangChain4jConfig(new NormativeRagProperties()).tierSearchExecutor();
        try {
            assertThat(executor).isInstanceOf(ThreadPoolExecutor.class);
            assertThat(((ThreadPoolExecutor) executor).getCorePoolSize()).isEqualTo(4);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void tierSearchExecutorSizeIsConfigurable() {
        NormativeRagProperties properties = new NormativeRagProperties();
        properties.getRetrieval().setSearchThreads(8);

        ExecutorService executor = new LangChain4jConfig(properties).tierSearchExecutor();
        try {
            assertThat(((ThreadPoolExecutor) executor).getMaximumPoolSize()).isEqualTo(8);
        } finally {
            executor.shutdownNow();
        }
    }
}
