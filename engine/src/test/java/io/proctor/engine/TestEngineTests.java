/**
 * Copyright Proctor Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.proctor.engine;

import io.proctor.engine.fixtures.FixtureCycleException;
import io.proctor.engine.plan.ExecutionPlan;
import io.proctor.engine.plan.SkipReasons;
import io.proctor.engine.registry.FixtureDescriptor;
import io.proctor.engine.registry.FixtureScope;
import io.proctor.engine.registry.HookKind;
import io.proctor.engine.registry.Registry;
import io.proctor.engine.registry.SuiteDescriptor;
import io.proctor.engine.registry.TestBody;
import io.proctor.engine.registry.TestDescriptor;
import io.proctor.engine.results.RunListener;
import io.proctor.engine.results.RunSummary;
import io.proctor.engine.results.SuiteError;
import io.proctor.engine.results.TestOutcome;
import io.proctor.engine.results.TestStatus;
import io.proctor.engine.runner.TestState;
import io.proctor.test.common.AssertExtensions;
import io.proctor.test.common.IntentionalException;
import io.proctor.test.common.ThreadPooledTestSuite;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import lombok.val;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

/**
 * End-to-end tests for the TestEngine class.
 */
public class TestEngineTests extends ThreadPooledTestSuite {
    private static final TestBody PASS = ctx -> { };
    private static final TestBody FAIL = ctx -> {
        throw new IntentionalException();
    };
    @Rule
    public Timeout globalTimeout = Timeout.seconds(60);

    @Override
    protected int getThreadPoolSize() {
        return 2;
    }

    /**
     * Ignored tests are SKIPPED and their body is never invoked.
     */
    @Test
    public void testIgnored() {
        AtomicInteger invocations = new AtomicInteger();
        Registry registry = new Registry();
        registry.register(SuiteDescriptor.builder()
                                         .name("s")
                                         .test(TestDescriptor.builder().name("ignored").ignored(true).body(ctx -> invocations.incrementAndGet()).build())
                                         .test(TestDescriptor.builder().name("runs").body(PASS).build())
                                         .build());

        RunSummary summary = run(registry, EngineConfig.builder().build());
        TestOutcome ignored = summary.getOutcome("s", "ignored");
        Assert.assertEquals(TestStatus.SKIPPED, ignored.getStatus());
        Assert.assertEquals(SkipReasons.IGNORED, ignored.getReason());
        Assert.assertEquals(0, ignored.getAttempts());
        Assert.assertEquals(0, invocations.get());
        Assert.assertTrue(summary.isSuccessful());
        Assert.assertEquals(1, summary.getCount(TestStatus.PASSED));
    }

    /**
     * With any "only" test, the summary contains only those tests and the verdict ignores every other one.
     */
    @Test
    public void testOnly() {
        AtomicInteger otherInvocations = new AtomicInteger();
        Registry registry = new Registry();
        registry.register(SuiteDescriptor.builder()
                                         .name("s1")
                                         .test(TestDescriptor.builder().name("focused").only(true).body(PASS).build())
                                         .test(TestDescriptor.builder().name("failing").body(ctx -> {
                                             otherInvocations.incrementAndGet();
                                             throw new IntentionalException();
                                         }).build())
                                         .build());
        registry.register(SuiteDescriptor.builder()
                                         .name("s2")
                                         .test(TestDescriptor.builder().name("alsoFocused").only(true).body(PASS).build())
                                         .test(TestDescriptor.builder().name("other").body(ctx -> otherInvocations.incrementAndGet()).build())
                                         .build());

        RunSummary summary = run(registry, EngineConfig.builder().build());
        Assert.assertEquals(Arrays.asList("s1::focused", "s2::alsoFocused"),
                summary.getOutcomes().stream().map(TestOutcome::getFullName).collect(Collectors.toList()));
        Assert.assertEquals(0, otherInvocations.get());
        Assert.assertTrue(summary.isSuccessful());
    }

    /**
     * A test failing n times and then passing is PASSED with n+1 attempts; one that always fails is FAILED with
     * n+1 attempts.
     */
    @Test
    public void testRetries() {
        final int retries = 2;
        AtomicInteger flakyInvocations = new AtomicInteger();
        AtomicInteger brokenInvocations = new AtomicInteger();
        Registry registry = new Registry();
        registry.register(SuiteDescriptor.builder()
                                         .name("s")
                                         .test(TestDescriptor.builder().name("flaky").retries(retries).body(ctx -> {
                                             if (flakyInvocations.incrementAndGet() <= retries) {
                                                 throw new IntentionalException();
                                             }
                                         }).build())
                                         .test(TestDescriptor.builder().name("broken").retries(retries).body(ctx -> {
                                             brokenInvocations.incrementAndGet();
                                             throw new IntentionalException();
                                         }).build())
                                         .build());

        RunSummary summary = run(registry, EngineConfig.builder().build());
        TestOutcome flaky = summary.getOutcome("s", "flaky");
        Assert.assertEquals(TestStatus.PASSED, flaky.getStatus());
        Assert.assertEquals(retries + 1, flaky.getAttempts());
        TestOutcome broken = summary.getOutcome("s", "broken");
        Assert.assertEquals(TestStatus.FAILED, broken.getStatus());
        Assert.assertEquals(retries + 1, broken.getAttempts());
        Assert.assertEquals(retries + 1, brokenInvocations.get());
        Assert.assertEquals(2, summary.getRetriedCount());
        Assert.assertFalse(summary.isSuccessful());
    }

    /**
     * A fixture dependency cycle aborts the run before any test executes.
     */
    @Test
    public void testFixtureCycle() {
        AtomicInteger invocations = new AtomicInteger();
        RunListener listener = Mockito.mock(RunListener.class);
        Registry registry = new Registry();
        registry.register(FixtureDescriptor.builder().name("a").dependsOn("b").producer(up -> "a").build());
        registry.register(FixtureDescriptor.builder().name("b").dependsOn("a").producer(up -> "b").build());
        registry.register(SuiteDescriptor.builder()
                                         .name("s")
                                         .test(TestDescriptor.builder().name("t").fixture("a").body(ctx -> invocations.incrementAndGet()).build())
                                         .test(TestDescriptor.builder().name("u").body(ctx -> invocations.incrementAndGet()).build())
                                         .build());
        TestEngine engine = new TestEngine(registry, EngineConfig.builder().build());
        engine.addListener(listener);
        AssertExtensions.assertThrows("Cycle not reported.", engine::run,
                ex -> ex instanceof FixtureCycleException && ex.getMessage().contains("a -> b -> a"));
        Assert.assertEquals(0, invocations.get());
        Mockito.verifyNoInteractions(listener);
    }

    /**
     * A suite fixture needed by 10 concurrent tests is produced once and torn down once, after the last test.
     */
    @Test
    public void testSuiteFixtureSingleFlight() {
        final int testCount = 10;
        AtomicInteger produced = new AtomicInteger();
        AtomicInteger tornDown = new AtomicInteger();
        AtomicInteger finishedBodies = new AtomicInteger();
        AtomicInteger finishedAtTeardown = new AtomicInteger(-1);
        Registry registry = new Registry();
        registry.register(FixtureDescriptor.builder()
                                           .name("db")
                                           .scope(FixtureScope.SUITE)
                                           .producer(up -> {
                                               Thread.sleep(100);
                                               return "db-" + produced.incrementAndGet();
                                           })
                                           .teardown(v -> {
                                               tornDown.incrementAndGet();
                                               finishedAtTeardown.set(finishedBodies.get());
                                           })
                                           .build());
        SuiteDescriptor.SuiteDescriptorBuilder suite = SuiteDescriptor.builder().name("s");
        for (int i = 0; i < testCount; i++) {
            suite.test(TestDescriptor.builder().name("t" + i).fixture("db").body(ctx -> {
                Assert.assertEquals("db-1", ctx.fixture("db", String.class));
                finishedBodies.incrementAndGet();
            }).build());
        }

        registry.register(suite.build());
        RunSummary summary = run(registry, EngineConfig.builder().with(EngineConfig.WORKER_COUNT, testCount).build());
        Assert.assertEquals(testCount, summary.getCount(TestStatus.PASSED));
        Assert.assertEquals("Producer not invoked exactly once.", 1, produced.get());
        Assert.assertEquals("Teardown not invoked exactly once.", 1, tornDown.get());
        Assert.assertEquals("Teardown ran before the last test finished.", testCount, finishedAtTeardown.get());
    }

    /**
     * A session fixture used by several suites is produced once and torn down once, after every suite has finished.
     * Its teardown failure is reported without affecting the verdict.
     */
    @Test
    public void testSessionFixture() {
        AtomicInteger produced = new AtomicInteger();
        AtomicInteger tornDown = new AtomicInteger();
        AtomicInteger suitesFinished = new AtomicInteger();
        AtomicInteger finishedAtTeardown = new AtomicInteger(-1);
        Registry registry = new Registry();
        registry.register(FixtureDescriptor.builder()
                                           .name("server")
                                           .scope(FixtureScope.SESSION)
                                           .producer(up -> "server-" + produced.incrementAndGet())
                                           .teardown(v -> {
                                               tornDown.incrementAndGet();
                                               finishedAtTeardown.set(suitesFinished.get());
                                               throw new IntentionalException("session teardown");
                                           })
                                           .build());
        for (String name : Arrays.asList("a", "b", "c")) {
            SuiteDescriptor.SuiteDescriptorBuilder suite = SuiteDescriptor.builder()
                    .name(name)
                    .fixture("server")
                    .withHook(HookKind.AFTER_ALL, "count", ctx -> suitesFinished.incrementAndGet());
            for (int i = 0; i < 3; i++) {
                suite.test(TestDescriptor.builder().name("t" + i).body(ctx -> Assert.assertEquals("server-1", ctx.fixture("server", String.class))).build());
            }

            registry.register(suite.build());
        }

        RunSummary summary = run(registry, EngineConfig.builder().with(EngineConfig.WORKER_COUNT, 4).build());
        Assert.assertEquals(9, summary.getCount(TestStatus.PASSED));
        Assert.assertTrue(summary.isSuccessful());
        Assert.assertEquals("Producer not invoked exactly once.", 1, produced.get());
        Assert.assertEquals("Teardown not invoked exactly once.", 1, tornDown.get());
        Assert.assertEquals("Teardown ran before every suite finished.", 3, finishedAtTeardown.get());
        Assert.assertEquals(1, summary.getSessionErrors().size());
        Assert.assertEquals("session teardown", summary.getSessionErrors().get(0).getMessage());
        Assert.assertTrue(summary.getSuiteErrors().isEmpty());
    }

    /**
     * A before_all failure skips every test of its suite, after_all still runs once, and other suites are unaffected.
     */
    @Test
    public void testBeforeAllFailure() {
        AtomicInteger afterAll = new AtomicInteger();
        AtomicInteger bodies = new AtomicInteger();
        Registry registry = new Registry();
        SuiteDescriptor.SuiteDescriptorBuilder broken = SuiteDescriptor.builder()
                .name("broken")
                .withHook(HookKind.BEFORE_ALL, "setup", ctx -> {
                    throw new IntentionalException("setup");
                })
                .withHook(HookKind.AFTER_ALL, "cleanup", ctx -> afterAll.incrementAndGet());
        for (int i = 0; i < 5; i++) {
            broken.test(TestDescriptor.builder().name("t" + i).body(ctx -> bodies.incrementAndGet()).build());
        }

        registry.register(broken.build());
        registry.register(SuiteDescriptor.builder().name("healthy").test(TestDescriptor.builder().name("t").body(PASS).build()).build());

        RunSummary summary = run(registry, EngineConfig.builder().with(EngineConfig.WORKER_COUNT, 3).build());
        List<TestOutcome> brokenOutcomes = summary.getSuiteResults().get(0).getOutcomes();
        Assert.assertEquals(5, brokenOutcomes.size());
        for (TestOutcome o : brokenOutcomes) {
            Assert.assertEquals(TestStatus.SKIPPED, o.getStatus());
            Assert.assertEquals(SkipReasons.SUITE_SETUP_FAILED, o.getReason());
            Assert.assertEquals("setup", o.getFailure().getMessage());
        }

        Assert.assertEquals(0, bodies.get());
        Assert.assertEquals("after_all not invoked exactly once.", 1, afterAll.get());
        Assert.assertEquals(TestStatus.PASSED, summary.getOutcome("healthy", "t").getStatus());
        Assert.assertEquals(Collections.singletonList(SuiteError.Phase.BEFORE_ALL),
                summary.getSuiteErrors().stream().map(SuiteError::getPhase).collect(Collectors.toList()));
    }

    /**
     * A test that never returns within its timeout is TIMED_OUT, and after_each still runs.
     */
    @Test
    public void testTimeout() {
        AtomicInteger afterEach = new AtomicInteger();
        Registry registry = new Registry();
        registry.register(SuiteDescriptor.builder()
                                         .name("s")
                                         .test(TestDescriptor.builder().name("hangs").timeout(Duration.ofMillis(100)).body(ctx -> {
                                             new CountDownLatch(1).await();
                                         }).build())
                                         .test(TestDescriptor.builder().name("fast").body(PASS).build())
                                         .withHook(HookKind.AFTER_EACH, "count", ctx -> afterEach.incrementAndGet())
                                         .build());

        RunSummary summary = run(registry, EngineConfig.builder().build());
        Assert.assertEquals(TestStatus.TIMED_OUT, summary.getOutcome("s", "hangs").getStatus());
        Assert.assertEquals(TestStatus.PASSED, summary.getOutcome("s", "fast").getStatus());
        Assert.assertEquals(2, afterEach.get());
        Assert.assertFalse(summary.isSuccessful());
    }

    /**
     * Two runs of the same registry and configuration with a single worker yield identical statuses, and hooks and
     * tests run in plan order.
     */
    @Test
    public void testDeterminismWithSingleWorker() {
        List<String> firstEvents = Collections.synchronizedList(new ArrayList<>());
        List<String> secondEvents = Collections.synchronizedList(new ArrayList<>());
        RunSummary first = run(mixedRegistry(firstEvents), EngineConfig.builder().with(EngineConfig.WORKER_COUNT, 1).build());
        RunSummary second = run(mixedRegistry(secondEvents), EngineConfig.builder().with(EngineConfig.WORKER_COUNT, 1).build());

        Assert.assertEquals(statuses(first), statuses(second));
        Assert.assertEquals(firstEvents, secondEvents);
        Assert.assertEquals(Arrays.asList("a:before_all", "a:before_each:t1", "a:t1", "a:after_each:t1",
                "a:before_each:t2", "a:t2", "a:after_each:t2", "a:after_all", "b:t3"), firstEvents);
        Assert.assertEquals(Arrays.asList(TestStatus.PASSED, TestStatus.FAILED, TestStatus.SKIPPED, TestStatus.PASSED), statuses(first));
    }

    /**
     * Aborting a run skips the test in flight and every test that has not started, while the in-flight test's
     * after_each hooks and fixtures and the started suite are still torn down.
     */
    @Test
    public void testAbort() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        AtomicInteger afterAll = new AtomicInteger();
        AtomicInteger afterEach = new AtomicInteger();
        AtomicInteger laterBodies = new AtomicInteger();
        AtomicInteger testFixtureReleased = new AtomicInteger();
        AtomicInteger suiteFixtureReleased = new AtomicInteger();
        Registry registry = new Registry();
        registry.register(FixtureDescriptor.builder().name("conn").scope(FixtureScope.SUITE).producer(up -> "conn")
                                           .teardown(v -> suiteFixtureReleased.incrementAndGet()).build());
        registry.register(FixtureDescriptor.builder().name("tx").dependsOn("conn").producer(up -> "tx")
                                           .teardown(v -> testFixtureReleased.incrementAndGet()).build());
        registry.register(SuiteDescriptor.builder()
                                         .name("s")
                                         .test(TestDescriptor.builder().name("blocks").fixture("tx").body(ctx -> {
                                             started.countDown();
                                             new CountDownLatch(1).await();
                                         }).build())
                                         .test(TestDescriptor.builder().name("later").body(ctx -> laterBodies.incrementAndGet()).build())
                                         .withHook(HookKind.AFTER_EACH, "count", ctx -> afterEach.incrementAndGet())
                                         .withHook(HookKind.AFTER_ALL, "cleanup", ctx -> afterAll.incrementAndGet())
                                         .build());
        registry.register(SuiteDescriptor.builder().name("untouched").test(TestDescriptor.builder().name("t").body(PASS).build()).build());
        TestEngine engine = new TestEngine(registry, EngineConfig.builder().with(EngineConfig.WORKER_COUNT, 1).build());
        executorService().execute(() -> {
            try {
                started.await();
                engine.abort();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });

        RunSummary summary = engine.run();
        Assert.assertTrue(summary.isAborted());
        Assert.assertTrue(engine.isAborted());
        Assert.assertEquals(3, summary.getCount(TestStatus.SKIPPED));
        for (TestOutcome o : summary.getOutcomes()) {
            Assert.assertEquals(SkipReasons.RUN_ABORTED, o.getReason());
        }

        Assert.assertEquals(1, summary.getOutcome("s", "blocks").getAttempts());
        Assert.assertEquals(0, laterBodies.get());
        Assert.assertEquals(1, afterEach.get());
        Assert.assertEquals("Started suite not torn down.", 1, afterAll.get());
        Assert.assertEquals(1, testFixtureReleased.get());
        Assert.assertEquals(1, suiteFixtureReleased.get());
        Assert.assertTrue(summary.getSuiteErrors().isEmpty());
        Assert.assertTrue("Skipped tests must not fail the run.", summary.isSuccessful());
    }

    /**
     * With fail-fast enabled, tests that have not started are skipped once a test fails the run.
     */
    @Test
    public void testFailFast() {
        Registry registry = new Registry();
        registry.register(SuiteDescriptor.builder()
                                         .name("s")
                                         .test(TestDescriptor.builder().name("passes").body(PASS).build())
                                         .test(TestDescriptor.builder().name("fails").body(FAIL).build())
                                         .test(TestDescriptor.builder().name("never").body(PASS).build())
                                         .build());
        registry.register(SuiteDescriptor.builder().name("s2").test(TestDescriptor.builder().name("never").body(PASS).build()).build());

        RunSummary summary = run(registry, EngineConfig.builder()
                                                       .with(EngineConfig.WORKER_COUNT, 1)
                                                       .with(EngineConfig.FAIL_FAST, true)
                                                       .build());
        Assert.assertEquals(Arrays.asList(TestStatus.PASSED, TestStatus.FAILED, TestStatus.SKIPPED, TestStatus.SKIPPED), statuses(summary));
        Assert.assertEquals(SkipReasons.FAIL_FAST, summary.getOutcome("s2", "never").getReason());
        Assert.assertFalse(summary.isSuccessful());
    }

    /**
     * Tests of a serial suite never overlap, while tests of a parallel suite do.
     */
    @Test
    public void testSerialAndParallelSuites() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        CyclicBarrier barrier = new CyclicBarrier(2);
        TestBody tracked = ctx -> {
            int now = running.incrementAndGet();
            maxRunning.accumulateAndGet(now, Math::max);
            Thread.sleep(20);
            running.decrementAndGet();
        };
        Registry registry = new Registry();
        SuiteDescriptor.SuiteDescriptorBuilder serial = SuiteDescriptor.builder().name("serial").serial(true);
        for (int i = 0; i < 6; i++) {
            serial.test(TestDescriptor.builder().name("t" + i).body(tracked).build());
        }

        registry.register(serial.build());
        registry.register(SuiteDescriptor.builder()
                                         .name("parallel")
                                         .test(TestDescriptor.builder().name("left").body(ctx -> barrier.await(10, TimeUnit.SECONDS)).build())
                                         .test(TestDescriptor.builder().name("right").body(ctx -> barrier.await(10, TimeUnit.SECONDS)).build())
                                         .build());

        RunSummary summary = run(registry, EngineConfig.builder().with(EngineConfig.WORKER_COUNT, 4).build());
        Assert.assertEquals("Parallel tests did not overlap.", 8, summary.getCount(TestStatus.PASSED));
        Assert.assertEquals("Serial tests overlapped.", 1, maxRunning.get());
    }

    /**
     * A serial suite whose slot is taken does not hold back the other workers: tests of other suites start while
     * the serial suite is still running its first test.
     */
    @Test
    public void testBusySerialSuiteDoesNotBlockWorkers() {
        CountDownLatch parallelStarted = new CountDownLatch(3);
        Registry registry = new Registry();
        SuiteDescriptor.SuiteDescriptorBuilder serial = SuiteDescriptor.builder().name("serial").serial(true);
        for (int i = 0; i < 4; i++) {
            serial.test(TestDescriptor.builder().name("t" + i).body(ctx -> {
                Assert.assertTrue("Other suites did not start.", parallelStarted.await(10, TimeUnit.SECONDS));
            }).build());
        }

        registry.register(serial.build());
        SuiteDescriptor.SuiteDescriptorBuilder parallel = SuiteDescriptor.builder().name("parallel");
        for (int i = 0; i < 3; i++) {
            parallel.test(TestDescriptor.builder().name("p" + i).body(ctx -> parallelStarted.countDown()).build());
        }

        registry.register(parallel.build());
        RunSummary summary = run(registry, EngineConfig.builder().with(EngineConfig.WORKER_COUNT, 4).build());
        Assert.assertEquals("Serial suite kept other suites waiting.", 7, summary.getCount(TestStatus.PASSED));
    }

    /**
     * Verifies the result stream, including isolation from failing listeners, and the state transitions of tests.
     */
    @Test
    public void testListeners() {
        Registry registry = new Registry();
        registry.register(SuiteDescriptor.builder()
                                         .name("s")
                                         .test(TestDescriptor.builder().name("a").body(PASS).build())
                                         .test(TestDescriptor.builder().name("b").retries(1).body(FAIL).build())
                                         .test(TestDescriptor.builder().name("c").ignored(true).body(PASS).build())
                                         .build());
        RunListener listener = Mockito.mock(RunListener.class);
        RunListener failing = Mockito.mock(RunListener.class);
        Mockito.doThrow(new IntentionalException()).when(failing).onTestFinished(Mockito.any());
        List<TestState> transitions = Collections.synchronizedList(new ArrayList<>());

        TestEngine engine = new TestEngine(registry, EngineConfig.builder().with(EngineConfig.WORKER_COUNT, 1).build());
        engine.addListener(failing);
        engine.addListener(listener);
        engine.setTransitionListener((test, state) -> transitions.add(state));
        RunSummary summary = engine.run();

        Mockito.verify(listener).onRunStarted(Mockito.any(ExecutionPlan.class));
        Mockito.verify(listener).onSuiteStarted("s");
        Mockito.verify(listener, Mockito.times(2)).onTestStarted(Mockito.any());
        Mockito.verify(listener).onAttemptRetried(Mockito.any(), Mockito.any());
        ArgumentCaptor<TestOutcome> finished = ArgumentCaptor.forClass(TestOutcome.class);
        Mockito.verify(listener, Mockito.times(3)).onTestFinished(finished.capture());
        Assert.assertEquals(Arrays.asList("a", "b", "c"),
                finished.getAllValues().stream().map(TestOutcome::getTestName).collect(Collectors.toList()));
        Mockito.verify(listener).onSuiteFinished("s");
        Mockito.verify(listener).onRunFinished(summary);
        Assert.assertEquals(2, transitions.stream().filter(s -> s == TestState.DONE).count());
        Assert.assertTrue(transitions.contains(TestState.RETRYING));

        AssertExtensions.assertThrows("Engine ran twice.", engine::run, ex -> ex instanceof IllegalStateException);
    }

    /**
     * Verifies the handling of teardown failures under both verdict policies, and of empty runs.
     */
    @Test
    public void testTeardownFailuresAndEmptyRun() {
        for (boolean strict : new boolean[]{false, true}) {
            Registry registry = new Registry();
            registry.register(SuiteDescriptor.builder()
                                             .name("s")
                                             .test(TestDescriptor.builder().name("t").body(PASS).build())
                                             .withHook(HookKind.AFTER_EACH, "broken", ctx -> {
                                                 throw new IntentionalException();
                                             })
                                             .build());
            RunSummary summary = run(registry, EngineConfig.builder().with(EngineConfig.TEARDOWN_FAILURES_FAIL_RUN, strict).build());
            Assert.assertEquals(TestStatus.TEARDOWN_FAILED, summary.getOutcome("s", "t").getStatus());
            Assert.assertEquals(!strict, summary.isSuccessful());
        }

        val empty = run(new Registry(), EngineConfig.builder().build());
        Assert.assertEquals(0, empty.getTotal());
        Assert.assertTrue(empty.isSuccessful());
    }

    //region Helpers

    private static RunSummary run(Registry registry, EngineConfig config) {
        return new TestEngine(registry, config).run();
    }

    private static List<TestStatus> statuses(RunSummary summary) {
        return summary.getOutcomes().stream().map(TestOutcome::getStatus).collect(Collectors.toList());
    }

    private static Registry mixedRegistry(List<String> events) {
        Registry registry = new Registry();
        registry.register(SuiteDescriptor.builder()
                                         .name("a")
                                         .withHook(HookKind.BEFORE_ALL, null, ctx -> events.add("a:before_all"))
                                         .withHook(HookKind.BEFORE_EACH, null, ctx -> events.add("a:before_each:" + ctx.getTestName()))
                                         .withHook(HookKind.AFTER_EACH, null, ctx -> events.add("a:after_each:" + ctx.getTestName()))
                                         .withHook(HookKind.AFTER_ALL, null, ctx -> events.add("a:after_all"))
                                         .test(TestDescriptor.builder().name("t1").body(ctx -> events.add("a:t1")).build())
                                         .test(TestDescriptor.builder().name("t2").body(ctx -> {
                                             events.add("a:t2");
                                             throw new IntentionalException();
                                         }).build())
                                         .test(TestDescriptor.builder().name("ignored").ignored(true).body(PASS).build())
                                         .build());
        registry.register(SuiteDescriptor.builder()
                                         .name("b")
                                         .test(TestDescriptor.builder().name("t3").body(ctx -> events.add("b:t3")).build())
                                         .build());
        return registry;
    }

    //endregion
}
