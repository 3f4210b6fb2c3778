package com.questrail.btlink.mux;

import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.subscribers.TestSubscriber;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TextSegmentingOperatorTest
 * -----------------------------------------------------------------------------
 * Segmentation of byte streams into text records, independent of any channel.
 */
public class TextSegmentingOperatorTest {

    private static final TextSegmentingOperator CR_LF =
            new TextSegmentingOperator(Set.of((byte) 0x0D, (byte) 0x0A), StandardCharsets.UTF_8);

    private static Flowable<Byte> bytes(int... values) {
        Byte[] boxed = new Byte[values.length];
        for (int i = 0; i < values.length; i++) {
            boxed[i] = (byte) values[i];
        }
        return Flowable.fromArray(boxed);
    }

    @Test
    void everyDelimiterCutsARecordAndTheTailIsFlushedOnCompletion() {
        TestSubscriber<String> ts = bytes(0x41, 0x42, 0x0D, 0x0A, 0x43, 0x44)
                .lift(CR_LF)
                .test();

        ts.assertValues("AB", "", "CD");
        ts.assertComplete();
    }

    @Test
    void pendingTextIsFlushedOnceBeforeError() {
        IOException failure = new IOException("link lost");

        TestSubscriber<String> ts = bytes('h', 'i', '\n', 'y', 'o')
                .concatWith(Flowable.error(failure))
                .lift(CR_LF)
                .test();

        ts.assertValues("hi", "yo");
        ts.assertError(failure);
    }

    @Test
    void emptyTailIsNotFlushed() {
        TestSubscriber<String> ts = bytes('o', 'k', '\n')
                .lift(CR_LF)
                .test();

        ts.assertValues("ok");
        ts.assertComplete();
    }

    @Test
    void multiByteCharactersSurviveSegmentation() {
        byte[] encoded = "héllo\n".getBytes(StandardCharsets.UTF_8);
        int[] values = new int[encoded.length];
        for (int i = 0; i < encoded.length; i++) {
            values[i] = encoded[i];
        }

        bytes(values).lift(CR_LF).test().assertValues("héllo");
    }

    @Test
    void customDelimiterSet() {
        TextSegmentingOperator semicolon =
                new TextSegmentingOperator(Set.of((byte) ';'), StandardCharsets.US_ASCII);

        bytes('a', ';', 'b', '\n', ';').lift(semicolon).test()
                .assertValues("a", "b\n")
                .assertComplete();
    }

    @Test
    void emptyDelimiterSetIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new TextSegmentingOperator(Set.of(), StandardCharsets.UTF_8));
    }
}
