package msgrepl.node;

import msgrepl.common.Types.Message;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MessageStoreTest {

    private static Message msg(int origin, long version) {
        return new Message(origin, 1L, version, "text " + origin + "/" + version, "user", 1000L + version);
    }

    @Test
    void duplicateAppendIsANoOp() {
        MessageStore store = new MessageStore();

        assertThat(store.append(msg(1, 1))).isTrue();
        assertThat(store.append(msg(1, 1))).isFalse();
        assertThat(store.append(new Message(1, 1L, 1, "other text, same identity", "x", 0L))).isFalse();

        assertThat(store.listAll()).hasSize(1);
        assertThat(store.listAll().get(0).getText()).isEqualTo("text 1/1");
    }

    @Test
    void listingKeepsInsertionOrder() {
        MessageStore store = new MessageStore();
        store.append(msg(2, 1));
        store.append(msg(1, 2));
        store.append(msg(1, 1));

        assertThat(store.listAll()).extracting(Message::getId).containsExactly("2-1-1", "1-1-2", "1-1-1");
    }

    @Test
    void listingIsASnapshot() {
        MessageStore store = new MessageStore();
        store.append(msg(1, 1));
        List<Message> snapshot = store.listAll();

        store.append(msg(1, 2));

        assertThat(snapshot).hasSize(1);
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void tracksHighestVersionPerOrigin() {
        MessageStore store = new MessageStore();
        store.append(msg(1, 3));
        store.append(msg(1, 1));
        store.append(msg(2, 7));

        assertThat(store.highestVersion(1, 1L)).hasValue(3);
        assertThat(store.highestVersion(2, 1L)).hasValue(7);
        assertThat(store.highestVersion(3, 1L)).isEmpty();
        assertThat(store.contains("1-1-1")).isTrue();
        assertThat(store.contains("1-1-2")).isFalse();
        assertThat(store.digest()).isEqualTo(Map.of("1-1", 3L, "2-1", 7L));
    }

    @Test
    void eachIncarnationIsItsOwnStream() {
        MessageStore store = new MessageStore();
        store.append(new Message(1, 100L, 1, "before restart", "u", 1L));
        store.append(new Message(1, 100L, 2, "before restart", "u", 2L));
        Message after = store.appendLocal(1, 200L, "after restart", "u", 3L);

        assertThat(after.getId()).isEqualTo("1-200-1");
        assertThat(store.size()).isEqualTo(3);
        assertThat(store.highestVersion(1, 100L)).hasValue(2);
        assertThat(store.highestVersion(1, 200L)).hasValue(1);
        assertThat(store.digest()).isEqualTo(Map.of("1-100", 2L, "1-200", 1L));
    }

    @Test
    void newerStreamDoesNotHideAnOlderOne() {
        MessageStore store = new MessageStore();
        store.append(new Message(1, 100L, 1, "old", "u", 1L));
        store.append(new Message(1, 200L, 1, "new", "u", 2L));

        // the remote only knows the newer incarnation
        List<Message> missing = store.missingFrom(Map.of("1-200", 1L));

        assertThat(missing).extracting(Message::getId).containsExactly("1-100-1");
    }

    @Test
    void appendLocalAllocatesConsecutiveVersions() {
        MessageStore store = new MessageStore();
        Message first = store.appendLocal(4, 9L, "a", "alice", 1L);
        Message second = store.appendLocal(4, 9L, "b", "bob", 2L);

        assertThat(first.getId()).isEqualTo("4-9-1");
        assertThat(second.getId()).isEqualTo("4-9-2");
        assertThat(store.listAll()).containsExactly(first, second);
    }

    @Test
    void missingFromReturnsEverythingAboveTheRemoteWatermarks() {
        MessageStore store = new MessageStore();
        store.append(msg(1, 1));
        store.append(msg(1, 2));
        store.append(msg(2, 1));
        store.append(msg(1, 3));

        List<Message> missing = store.missingFrom(Map.of("1-1", 1L));

        assertThat(missing).extracting(Message::getId).containsExactly("1-1-2", "1-1-3", "2-1-1");
        assertThat(store.missingFrom(store.digest())).isEmpty();
    }

    @Test
    void mergingTheSameBatchTwiceChangesNothing() {
        MessageStore store = new MessageStore();
        List<Message> batch = List.of(msg(2, 2), msg(2, 1), msg(3, 1));

        assertThat(store.appendAll(batch)).isEqualTo(3);
        List<Message> afterFirst = store.listAll();
        assertThat(store.appendAll(batch)).isZero();

        assertThat(store.listAll()).isEqualTo(afterFirst);
        // batches are merged in (origin, incarnation, version) order
        assertThat(afterFirst).extracting(Message::getId).containsExactly("2-1-1", "2-1-2", "3-1-1");
    }

    @Test
    void mergeOrderDoesNotChangeTheResultingSet() {
        MessageStore a = new MessageStore();
        MessageStore b = new MessageStore();
        List<Message> x = List.of(msg(1, 1), msg(1, 2));
        List<Message> y = List.of(msg(2, 1), msg(1, 2));

        a.appendAll(x);
        a.appendAll(y);
        b.appendAll(y);
        b.appendAll(x);

        assertThat(a.digest()).isEqualTo(b.digest());
        assertThat(a.listAll()).containsExactlyInAnyOrderElementsOf(b.listAll());
    }

    @Test
    void concurrentWritersNeverLoseOrDuplicateEntries() throws Exception {
        MessageStore store = new MessageStore();
        int writers = 8;
        int perWriter = 500;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<java.util.concurrent.Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perWriter; i++) {
                    store.appendLocal(1, 1L, "t", "u", i);
                    store.append(msg(2, i + 1));
                    store.listAll();
                }
                return null;
            }));
        }
        start.countDown();
        for (java.util.concurrent.Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(store.highestVersion(1, 1L)).hasValue(writers * perWriter);
        assertThat(store.highestVersion(2, 1L)).hasValue(perWriter);
        assertThat(store.size()).isEqualTo(writers * perWriter + perWriter);
    }
}
