package io.safecalc.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.safecalc.core.error.CalcException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

/** One shared engine evaluated from many threads gives the same answers as sequential use. */
class ConcurrentEvaluationTest {

    private static final int THREADS = 8;
    private static final int ITERATIONS = 500;

    private static final Map<String, Double> EXPECTED = Map.of(
            "2 + 2", 4.0,
            "-7 // 2", -4.0,
            "-7 % 2", 1.0,
            "sqrt(16) * 2", 8.0,
            "2 ** 10", 1024.0,
            "4×5", 20.0,
            "abs(-3) + round(2.5)", 5.0);

    @Test
    void sharedEngineIsThreadSafe() throws Exception {
        CalculatorEngine engine = new CalculatorEngine();
        List<String> expressions = new ArrayList<>(EXPECTED.keySet());
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int t = 0; t < THREADS; t++) {
                int offset = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    int mismatches = 0;
                    for (int i = 0; i < ITERATIONS; i++) {
                        String expression = expressions.get((i + offset) % expressions.size());
                        if (engine.evaluate(expression) != EXPECTED.get(expression)) {
                            mismatches++;
                        }
                        try {
                            engine.evaluate("1/0");
                            mismatches++;
                        } catch (CalcException expected) {
                            // rejection is the correct outcome
                        }
                    }
                    return mismatches;
                }));
            }
            start.countDown();
            for (Future<Integer> future : futures) {
                assertThat(future.get(30, TimeUnit.SECONDS)).isZero();
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
