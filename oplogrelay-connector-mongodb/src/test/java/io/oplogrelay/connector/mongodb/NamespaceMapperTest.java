/*
 * Copyright Oplog Relay Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.oplogrelay.connector.mongodb;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.bson.Document;
import org.junit.After;
import org.junit.Test;

public class NamespaceMapperTest {

    private NamespaceMapper mapper;
    private ExecutorService executor;

    @After
    public void afterEach() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    public void shouldMapEveryNamespaceToItselfWithoutConfiguration() {
        mapper = NamespaceMapper.builder().build();
        assertThat(mapper.mapNamespace("db1.col1")).contains("db1.col1");
        assertThat(mapper.resolve("db1.col1")).contains(MappedNamespace.of("db1.col1"));
        assertThat(mapper.unmap("db1.col1")).contains("db1.col1");
        assertThat(mapper.mapDatabase("db1")).containsOnly("db1");
        assertThat(mapper.fields("db1.col1")).isEqualTo(FieldScope.NONE);
        assertThat(mapper.projection("db1.col1", null)).isNull();
    }

    @Test
    public void shouldOnlyMapIncludedNamespaces() {
        mapper = NamespaceMapper.builder().includeNamespaces(Arrays.asList("db1.col1", "db1.col2")).build();
        assertThat(mapper.mapNamespace("db1.col1")).contains("db1.col1");
        assertThat(mapper.mapNamespace("db1.col2")).contains("db1.col2");
        assertThat(mapper.mapNamespace("db1.col4")).isEmpty();
        assertThat(mapper.isIncluded("db1.col4")).isFalse();
        assertThat(mapper.mapDatabase("db1")).containsOnly("db1");
        assertThat(mapper.mapDatabase("other")).isEmpty();
        assertThat(mapper.unmap("db1.col1")).contains("db1.col1");
        assertThat(mapper.unmap("db1.col4")).isEmpty();
    }

    @Test
    public void shouldMapIncludedWildcardNamespaces() {
        mapper = NamespaceMapper.builder().includeNamespaces(Collections.singletonList("db1.*")).build();
        assertThat(mapper.mapNamespace("db1.col1")).contains("db1.col1");
        assertThat(mapper.mapNamespace("db1.col1.sub")).contains("db1.col1.sub");
        assertThat(mapper.mapNamespace("db2.col1")).isEmpty();
        assertThat(mapper.mapDatabase("db1")).containsOnly("db1");
        assertThat(mapper.mapDatabase("db2")).isEmpty();
    }

    @Test
    public void shouldNotMapExcludedNamespacesButStillUnmapThem() {
        mapper = NamespaceMapper.builder().excludeNamespaces(Collections.singletonList("ex.*")).build();
        assertThat(mapper.mapNamespace("ex.clude")).isEmpty();
        assertThat(mapper.mapNamespace("ex.clude2")).isEmpty();
        assertThat(mapper.mapNamespace("in.clude")).contains("in.clude");
        assertThat(mapper.unmap("ex.clude")).contains("ex.clude");
    }

    @Test
    public void shouldExcludeLiteralNamespaces() {
        mapper = NamespaceMapper.builder().excludeNamespaces(Arrays.asList("db1.secret", "db2.secret")).build();
        assertThat(mapper.isIncluded("db1.secret")).isFalse();
        assertThat(mapper.isIncluded("db1.public")).isTrue();
    }

    @Test
    public void shouldUnmapWildcardTargets() {
        mapper = NamespaceMapper.builder()
                .rename("db2.*", "db2.f*")
                .rename("db_*.foo", "db_new_*.foo")
                .build();
        assertThat(mapper.unmap("db2.foo")).contains("db2.oo");
        assertThat(mapper.unmap("db_new_123.foo")).contains("db_123.foo");
        assertThat(mapper.unmap("db_new_1.2.foo")).isEmpty();
        assertThat(mapper.unmap("other.foo")).isEmpty();
    }

    @Test
    public void shouldRenamePlainNamespaces() {
        mapper = NamespaceMapper.builder().rename("db1.col1", "newdb.newcol").build();
        assertThat(mapper.mapNamespace("db1.col1")).contains("newdb.newcol");
        assertThat(mapper.unmap("newdb.newcol")).contains("db1.col1");
        assertThat(mapper.mapNamespace("db1.col2")).isEmpty();
        assertThat(mapper.mapNamespace("db1.$cmd")).contains("newdb.$cmd");
        assertThat(mapper.unmap("newdb.$cmd")).contains("db1.$cmd");
        assertThat(mapper.mapDatabase("db1")).containsOnly("newdb");
    }

    @Test
    public void shouldRenameWildcardNamespacesAndRememberThem() {
        mapper = NamespaceMapper.builder().rename("db_*.foo", "db_new_*.foo").build();
        Optional<MappedNamespace> first = mapper.resolve("db_123.foo");
        assertThat(first).contains(MappedNamespace.of("db_new_123.foo"));
        assertThat(mapper.resolve("db_123.foo").get()).isSameAs(first.get());
        assertThat(mapper.unmap("db_new_123.foo")).contains("db_123.foo");
        assertThat(mapper.mapNamespace("db_1.2.foo")).isEmpty();
        assertThat(mapper.mapNamespace("db_1.bar")).isEmpty();
    }

    @Test
    public void shouldNotLetDatabaseWildcardMatchPeriods() {
        mapper = NamespaceMapper.builder().includeNamespaces(Collections.singletonList("db*.col")).build();
        assertThat(mapper.isIncluded("db1.col")).isTrue();
        assertThat(mapper.isIncluded("db.bar.col")).isFalse();
    }

    @Test
    public void shouldRoundTripNamespacesReachedThroughWildcards() {
        mapper = NamespaceMapper.builder()
                .rename("db1.*", "db1_copy.*")
                .rename("logs_*.events", "archive.events_*")
                .build();
        for (String namespace : Arrays.asList("db1.a", "db1.b.c", "logs_2020.events", "logs_.events")) {
            String target = mapper.mapNamespace(namespace).get();
            assertThat(mapper.unmap(target)).contains(namespace);
        }
    }

    @Test
    public void shouldMapDatabaseToAllTargetDatabases() {
        mapper = NamespaceMapper.builder()
                .rename("db1.col1", "a.col1")
                .rename("db1.col2", "b.col2")
                .build();
        assertThat(mapper.mapDatabase("db1")).containsOnly("a", "b");
        assertThat(mapper.mapDatabase("db2")).isEmpty();
    }

    @Test
    public void shouldMapDatabaseBeforeAnyCollectionWasResolved() {
        mapper = NamespaceMapper.builder().rename("db_*.foo", "db_new_*.foo").build();
        assertThat(mapper.mapDatabase("db_9")).containsOnly("db_new_9");
        assertThat(mapper.mapNamespace("db_9.$cmd")).contains("db_new_9.$cmd");
    }

    @Test
    public void shouldReturnUnmodifiableDatabaseTargets() {
        mapper = NamespaceMapper.builder().rename("db1.col1", "a.col1").build();
        assertThatThrownBy(() -> mapper.mapDatabase("db1").add("x")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    public void shouldRejectTwoSourcesMappedToSameTarget() {
        assertThatThrownBy(() -> NamespaceMapper.builder()
                .rename("db1.col1", "newdb.newcol")
                .rename("db2.col1", "newdb.newcol")
                .build())
                        .isInstanceOf(NamespaceMappingException.class)
                        .hasMessageContaining("newdb.newcol");
    }

    @Test
    public void shouldRejectWildcardMatchesMappedToSameTarget() {
        mapper = NamespaceMapper.builder()
                .rename("db1.a*", "db1.x*")
                .rename("db1.b*", "db1.x*")
                .build();
        assertThat(mapper.mapNamespace("db1.a1")).contains("db1.x1");
        assertThatThrownBy(() -> mapper.resolve("db1.b1"))
                .isInstanceOf(NamespaceMappingException.class)
                .hasMessageContaining("db1.a1")
                .hasMessageContaining("db1.b1");
        assertThat(mapper.unmap("db1.x1")).contains("db1.a1");
        assertThat(mapper.mapNamespace("db1.b2")).contains("db1.x2");
    }

    @Test
    public void shouldRejectBothIncludedAndExcludedNamespaces() {
        assertThatThrownBy(() -> NamespaceMapper.builder()
                .includeNamespaces(Collections.singletonList("db1.*"))
                .excludeNamespaces(Collections.singletonList("db2.*"))
                .build()).isInstanceOf(NamespaceMappingException.class);
    }

    @Test
    public void shouldRejectPatternsWithMoreThanOneWildcard() {
        assertThatThrownBy(() -> NamespaceMapper.builder().includeNamespaces(Collections.singletonList("db*.col*")).build())
                .isInstanceOf(NamespaceMappingException.class);
        assertThatThrownBy(() -> NamespaceMapper.builder().excludeNamespaces(Collections.singletonList("db*.col*")).build())
                .isInstanceOf(NamespaceMappingException.class);
        assertThatThrownBy(() -> NamespaceMapper.builder().rename("db*.col", "db*.col*").build())
                .isInstanceOf(NamespaceMappingException.class);
    }

    @Test
    public void shouldRejectRenamingLiteralToPattern() {
        assertThatThrownBy(() -> NamespaceMapper.builder().rename("db1.col", "db2.*").build())
                .isInstanceOf(NamespaceMappingException.class);
    }

    @Test
    public void shouldRejectIncludeAndExcludeFieldsOnSameNamespace() {
        assertThatThrownBy(() -> NamespaceMapper.builder()
                .map("db1.col1", null, Collections.singletonList("a"), Collections.singletonList("b"))
                .build()).isInstanceOf(NamespaceMappingException.class);
    }

    @Test
    public void shouldRejectGlobalIncludeAndExcludeFields() {
        assertThatThrownBy(() -> NamespaceMapper.builder()
                .includeFields(Collections.singletonList("a"))
                .excludeFields(Collections.singletonList("b"))
                .build()).isInstanceOf(NamespaceMappingException.class);
    }

    @Test
    public void shouldRejectNamespaceFieldsConflictingWithGlobalFields() {
        assertThatThrownBy(() -> NamespaceMapper.builder()
                .excludeFields(Collections.singletonList("secret"))
                .map("db1.col1", null, Collections.singletonList("a"), null)
                .build()).isInstanceOf(NamespaceMappingException.class);
        assertThatThrownBy(() -> NamespaceMapper.builder()
                .includeFields(Collections.singletonList("a"))
                .map("db1.col1", null, null, Collections.singletonList("secret"))
                .build()).isInstanceOf(NamespaceMappingException.class);
    }

    @Test
    public void shouldProjectGlobalIncludeFields() {
        mapper = NamespaceMapper.builder()
                .includeFields(Arrays.asList("foo", "nested.field"))
                .includeNamespaces(Collections.singletonList("db.*"))
                .build();
        Document expected = new Document("_id", 1).append("foo", 1).append("nested.field", 1);
        assertThat(mapper.projection("db.foo", null)).isEqualTo(expected);
        assertThat(mapper.projection("ignored.name", null)).isNull();
        assertThat(mapper.fields("ignored.name")).isEqualTo(FieldScope.NONE);
    }

    @Test
    public void shouldPreferNamespaceFieldsOverGlobalFields() {
        mapper = NamespaceMapper.builder()
                .includeFields(Collections.singletonList("foo"))
                .map("db.special", null, Collections.singletonList("bar"), null)
                .includeNamespaces(Collections.singletonList("db.*"))
                .build();
        assertThat(mapper.fields("db.special").includeFields()).containsExactly("_id", "bar");
        assertThat(mapper.fields("db.other").includeFields()).containsExactly("_id", "foo");
        assertThat(mapper.resolve("db.other").get().fields().isEmpty()).isTrue();
    }

    @Test
    public void shouldCarryNamespaceFieldsThroughWildcardMatches() {
        mapper = NamespaceMapper.builder()
                .map("db.*", "copy.*", null, Arrays.asList("_id", "password"))
                .build();
        MappedNamespace mapped = mapper.resolve("db.users").get();
        assertThat(mapped.name()).isEqualTo("copy.users");
        assertThat(mapped.excludeFields()).containsExactly("password");
        assertThat(mapped.includeFields()).isNull();
        assertThat(mapper.projection("db.users", null)).isEqualTo(new Document("password", 0));
    }

    @Test
    public void shouldLetCallerProjectionWin() {
        mapper = NamespaceMapper.builder().includeFields(Arrays.asList("foo", "bar")).build();
        Document projection = mapper.projection("db.coll", new Document("foo", 0).append("baz", 1));
        assertThat(projection).isEqualTo(new Document("_id", 1).append("foo", 0).append("bar", 1).append("baz", 1));
    }

    @Test
    public void shouldReturnCallerProjectionWhenNoFieldsApply() {
        mapper = NamespaceMapper.builder().includeNamespaces(Collections.singletonList("db.*")).build();
        Document projection = new Document("foo", 1);
        assertThat(mapper.projection("db.coll", projection)).isSameAs(projection);
    }

    @Test
    public void shouldLearnEachWildcardMatchOnceAcrossThreads() throws Exception {
        mapper = NamespaceMapper.builder().rename("db_*.foo", "db_new_*.foo").build();
        List<Future<MappedNamespace>> results = runConcurrently(32, i -> () -> mapper.resolve("db_42.foo").get());
        MappedNamespace first = results.get(0).get();
        assertThat(first.name()).isEqualTo("db_new_42.foo");
        for (Future<MappedNamespace> result : results) {
            assertThat(result.get()).isSameAs(first);
        }
    }

    @Test
    public void shouldLetOnlyOneOfConflictingConcurrentMatchesWin() throws Exception {
        mapper = NamespaceMapper.builder()
                .rename("db1.a*", "db1.x*")
                .rename("db1.b*", "db1.x*")
                .build();
        List<Future<MappedNamespace>> results = runConcurrently(32,
                i -> () -> mapper.resolve(i % 2 == 0 ? "db1.a1" : "db1.b1").get());
        int failures = 0;
        String winner = null;
        for (Future<MappedNamespace> result : results) {
            try {
                result.get();
                String source = mapper.unmap("db1.x1").get();
                assertThat(winner == null || winner.equals(source)).isTrue();
                winner = source;
            }
            catch (ExecutionException e) {
                assertThat(e.getCause()).isInstanceOf(NamespaceMappingException.class);
                ++failures;
            }
        }
        assertThat(failures).isEqualTo(16);
        assertThat(winner).isIn("db1.a1", "db1.b1");
    }

    private <T> List<Future<T>> runConcurrently(int count, TaskFactory<T> tasks) throws InterruptedException {
        executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<T>> results = new ArrayList<>();
        for (int i = 0; i != count; ++i) {
            Callable<T> task = tasks.create(i);
            results.add(executor.submit(() -> {
                start.await();
                return task.call();
            }));
        }
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        return results;
    }

    @FunctionalInterface
    private interface TaskFactory<T> {
        Callable<T> create(int index);
    }
}
