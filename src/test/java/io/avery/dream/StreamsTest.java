package io.avery.dream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(10)
class StreamsTest {
    
    @Test
    void testCollectFromList() throws Exception {
        for (List<Integer> list : List.of(List.<Integer>of(), List.of(1), List.of(3, 1, 4, 1, 5, 9, 2, 6))) {
            assertEquals(list, Streams.collect(Streams.fromList(list)));
        }
    }
    
    @Test
    void testFromIterable() throws Exception {
        Set<String> set = Set.of("only");
        assertEquals(List.of("only"), Streams.collect(Streams.fromIterable(set)));
    }
    
    @Test
    void testWriteInsideWith() throws Exception {
        Stream<String> stream = Stream.create();
        Streams.with(stream, s -> {
            s.write("hi");
            return null;
        });
        assertEquals(List.of("hi"), Streams.collect(stream));
    }
    
    @Test
    void testWithClosesWhenBodyThrows() throws Exception {
        Stream<String> stream = Stream.create();
        assertThrows(IllegalStateException.class, () -> Streams.with(stream, s -> {
            s.write("before");
            throw new IllegalStateException();
        }));
        assertEquals(List.of("before"), Streams.collect(stream));
    }
    
    @Test
    void testWithReturnsBodyResult() {
        Stream<String> stream = Stream.create();
        Integer result = Streams.with(stream, s -> 42);
        assertEquals(42, result);
    }
    
    @Test
    void testEachWritesToAnotherStream() throws Exception {
        Stream<Integer> input = Streams.fromList(List.of(1, 2, 3, 4, 5));
        Stream<Integer> output = Stream.create();
        Streams.each(input, i -> output.write(i * 2));
        output.close();
        
        assertEquals(List.of(2, 4, 6, 8, 10), Streams.collect(output));
    }
    
    @Test
    void testTryEachStopsAtFirstError() throws Exception {
        Stream<Integer> input = Streams.fromList(List.of(2, 1, 0, -1, -2));
        List<Integer> seen = new ArrayList<>();
        
        Result<Void, String> result = Streams.<Integer, String>tryEach(input, i -> {
            seen.add(i);
            return i < 0 ? Result.err("negative: " + i) : Result.ok(i);
        });
        
        assertEquals(Result.err("negative: -1"), result);
        assertEquals(List.of(2, 1, 0, -1), seen);
        // The rest of the input is left unread
        assertEquals(Optional.of(-2), input.next(Duration.ofSeconds(1)));
    }
    
    @Test
    void testTryEachOkAtEnd() throws Exception {
        Stream<Integer> input = Streams.fromList(List.of(1, 2, 3));
        Result<Void, String> result = Streams.<Integer, String>tryEach(input, i -> Result.ok(i));
        
        assertTrue(result.isOk());
        assertEquals(Result.ok(null), result);
    }
    
    @Test
    void testChainedMaps() throws Exception {
        Stream<Integer> plusOne = Streams.map(Streams.fromList(List.of(1, 2, 3)), i -> i + 1);
        Stream<Integer> timesTwo = Streams.map(plusOne, i -> i * 2);
        
        assertEquals(List.of(4, 6, 8), Streams.collect(timesTwo));
    }
    
    @Test
    void testMapChangesType() throws Exception {
        Stream<String> strings = Streams.map(Streams.fromList(List.of(1, 22, 333)), String::valueOf);
        assertEquals(List.of("1", "22", "333"), Streams.collect(strings));
    }
    
    @Test
    void testFilter() throws Exception {
        Stream<Integer> evens = Streams.filter(Streams.fromList(List.of(1, 2, 3, 4, 5, 6)), i -> i % 2 == 0);
        assertEquals(List.of(2, 4, 6), Streams.collect(evens));
    }
    
    @Test
    void testDuplicate() throws Exception {
        List<Integer> list = List.of(5, 3, 5, 8);
        Streams.Duplicates<Integer> duplicates = Streams.duplicate(Streams.fromList(list));
        
        List<Integer> first = Streams.collect(duplicates.first());
        List<Integer> second = Streams.collect(duplicates.second());
        
        assertEquals(list, first);
        assertEquals(first, second);
    }
    
    @Test
    void testReduce() throws Exception {
        Integer sum = Streams.reduce(Streams.fromList(List.of(1, 2, 3)), 0, Integer::sum);
        assertEquals(6, sum);
    }
    
    @Test
    void testReducePassesElementBeforeAccumulator() throws Exception {
        String folded = Streams.reduce(Streams.fromList(List.of("a", "b", "c")), "", (s, acc) -> acc + s);
        assertEquals("abc", folded);
    }
    
    @Test
    void testReduceOfEmptyReturnsInitial() throws Exception {
        Integer sum = Streams.reduce(Streams.<Integer>fromList(List.of()), 10, Integer::sum);
        assertEquals(10, sum);
    }
    
    @Test
    void testIteratorIsLazyAndNotRestartable() throws Exception {
        Stream<Integer> stream = Stream.create();
        Iterator<Integer> iterator = Streams.toIterator(stream);
        
        stream.write(1);
        assertTrue(iterator.hasNext());
        assertTrue(iterator.hasNext());
        assertEquals(1, iterator.next());
        
        stream.write(2);
        stream.close();
        assertEquals(2, iterator.next());
        assertFalse(iterator.hasNext());
        assertThrows(NoSuchElementException.class, iterator::next);
    }
    
    @Test
    void testSequence() throws Exception {
        int sum = Streams.toSequence(Streams.fromList(List.of(1, 2, 3, 4))).mapToInt(i -> i).sum();
        assertEquals(10, sum);
    }
    
    @Test
    void testIteratorInterrupted() {
        Iterator<Integer> iterator = Streams.toIterator(Stream.create());
        Thread.currentThread().interrupt();
        assertThrows(CancellationException.class, iterator::hasNext);
        assertTrue(Thread.interrupted());
    }
    
    @Test
    void testGeneratorRunsInCallingThread() throws Exception {
        AtomicReference<Thread> generatorThread = new AtomicReference<>();
        Stream<Integer> stream = Streams.generator((emit, stop) -> {
            generatorThread.set(Thread.currentThread());
            emit.accept(1);
            emit.accept(2);
            emit.accept(3);
            stop.run();
        });
        
        assertSame(Thread.currentThread(), generatorThread.get());
        assertEquals(List.of(1, 2, 3), Streams.collect(stream));
    }
    
    @Test
    void testGeneratorInsideSpawn() throws Exception {
        Stream<Stream<String>> handoff = Stream.create();
        Dream.spawn(() -> handoff.write(Streams.generator((emit, stop) -> {
            emit.accept("x");
            stop.run();
        })));
        
        Stream<String> generated = handoff.next(Duration.ofSeconds(5)).orElseThrow();
        assertEquals(List.of("x"), Streams.collect(generated));
    }
    
    @Test
    void testMapCallbackCrashReachesSpawner() {
        Stream<Integer> mapped = Streams.map(Streams.fromList(List.of(1, 2, 3)), i -> {
            if (i == 2) {
                throw new IllegalStateException("boom");
            }
            return i;
        });
        
        LinkedException e = assertThrows(LinkedException.class, () -> Streams.collect(mapped));
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals("boom", e.getCause().getMessage());
    }
    
    @Test
    void testFilterCallbackCrashReachesSpawner() {
        Stream<Integer> filtered = Streams.filter(Streams.fromList(List.of(1, 2, 3)), i -> {
            throw new UnsupportedOperationException();
        });
        
        LinkedException e = assertThrows(LinkedException.class, () -> filtered.next(Duration.ofSeconds(5)));
        assertInstanceOf(UnsupportedOperationException.class, e.getCause());
    }
    
    @Test
    void testCrashInNestedStageChainsToOutermostSpawner() {
        Dream<List<Integer>> outer = Dream.async(() -> {
            Stream<Integer> mapped = Streams.map(Streams.fromList(List.of(1)), i -> {
                throw new IllegalArgumentException("inner");
            });
            return Streams.collect(mapped);
        });
        
        LinkedException e = assertThrows(LinkedException.class, outer::await);
        LinkedException inner = assertInstanceOf(LinkedException.class, e.getCause());
        assertInstanceOf(IllegalArgumentException.class, inner.getCause());
    }
}
