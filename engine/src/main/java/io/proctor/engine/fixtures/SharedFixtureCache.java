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
package io.proctor.engine.fixtures;

import com.google.common.base.Preconditions;
import io.proctor.common.Exceptions;
import io.proctor.engine.registry.FixtureDescriptor;
import io.proctor.engine.registry.FixtureScope;
import io.proctor.engine.registry.FixtureValues;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Memo of shared fixture values: SUITE-scoped ones (one cache per suite) or SESSION-scoped ones (one cache per run).
 * <p>
 * Instantiation is single-flight: the first requester of a fixture invokes its producer on its own thread, while
 * concurrent requesters of the same fixture block until that instantiation completes and then share its outcome.
 * A failed instantiation is remembered as well, so a producer is never invoked more than once per cache.
 */
@Slf4j
@ThreadSafe
public class SharedFixtureCache {
    //region Members

    @Getter
    private final FixtureScope scope;
    @Getter
    private final String owner;
    @GuardedBy("entries")
    private final Map<String, CompletableFuture<Object>> entries = new HashMap<>();
    @GuardedBy("entries")
    private final List<FixtureInstance> created = new ArrayList<>();
    @GuardedBy("entries")
    private boolean released;

    //endregion

    /**
     * Creates a new instance of the SharedFixtureCache class.
     *
     * @param scope The scope of the fixtures this cache holds. Must be SUITE or SESSION.
     * @param owner The name of the suite (or run) this cache belongs to. Used for logging.
     */
    public SharedFixtureCache(@NonNull FixtureScope scope, @NonNull String owner) {
        Preconditions.checkArgument(scope != FixtureScope.TEST, "Test-scoped fixtures cannot be shared.");
        this.scope = scope;
        this.owner = owner;
    }

    //region Operations

    /**
     * Gets the value of the given fixture, producing it if this is the first request for it.
     *
     * @param fixture  The fixture to get. Must have the scope of this cache.
     * @param upstream The values of the fixture's dependencies. Only used if the fixture needs to be produced.
     * @return The fixture value.
     * @throws FixtureSetupException If the producer failed, now or on an earlier request.
     * @throws IllegalStateException If this cache has been released.
     */
    public Object getOrCreate(FixtureDescriptor fixture, FixtureValues upstream) {
        Preconditions.checkArgument(fixture.getScope() == this.scope, "Fixture '%s' is not %s-scoped.", fixture.getName(), this.scope);
        CompletableFuture<Object> entry;
        boolean first = false;
        synchronized (this.entries) {
            Preconditions.checkState(!this.released, "Fixtures of %s have already been released.", this);
            entry = this.entries.get(fixture.getName());
            if (entry == null) {
                entry = new CompletableFuture<>();
                this.entries.put(fixture.getName(), entry);
                first = true;
            }
        }

        if (first) {
            produce(fixture, upstream, entry);
        }

        try {
            return entry.join();
        } catch (CompletionException ex) {
            throw new FixtureSetupException(fixture.getName(), Exceptions.unwrap(ex));
        }
    }

    /**
     * Releases every fixture instance produced so far, exactly once, in reverse creation order. After this call,
     * {@link #getOrCreate} fails.
     *
     * @return The teardown failures, in release order. Empty if all succeeded or if already released.
     */
    public List<Throwable> release() {
        List<FixtureInstance> toRelease;
        synchronized (this.entries) {
            if (this.released) {
                return Collections.emptyList();
            }

            this.released = true;
            toRelease = new ArrayList<>(this.created);
            this.created.clear();
        }

        Collections.reverse(toRelease);
        List<Throwable> failures = new ArrayList<>();
        for (FixtureInstance instance : toRelease) {
            Throwable failure = instance.release();
            if (failure != null) {
                failures.add(failure);
            }
        }

        log.debug("{}: released fixtures {} ({} failure(s)).", this, toRelease, failures.size());
        return failures;
    }

    @Override
    public String toString() {
        return String.format("%s fixtures of '%s'", this.scope, this.owner);
    }

    //endregion

    //region Helpers

    private void produce(FixtureDescriptor fixture, FixtureValues upstream, CompletableFuture<Object> entry) {
        log.debug("{}: producing fixture '{}'.", this, fixture.getName());
        Object value;
        try {
            value = fixture.getProducer().produce(upstream);
        } catch (Throwable ex) {
            entry.completeExceptionally(ex);
            if (Exceptions.mustRethrow(ex)) {
                throw Exceptions.sneakyThrow(ex);
            }

            log.warn("{}: fixture '{}' could not be produced.", this, fixture.getName(), ex);
            return;
        }

        FixtureInstance instance = new FixtureInstance(fixture, value);
        boolean tracked;
        synchronized (this.entries) {
            tracked = !this.released;
            if (tracked) {
                this.created.add(instance);
            }
        }

        if (!tracked) {
            // Released while producing; nobody else will tear this one down.
            instance.release();
        }

        entry.complete(value);
    }

    //endregion
}
