package com.protorpc.codec;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;

import com.google.protobuf.Duration;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Timestamp;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;

import static org.assertj.core.api.Assertions.*;

class ProtobufCodecTest {

    private static final Timestamp SAMPLE = Timestamp.newBuilder().setSeconds(1_700_000_000L).setNanos(42).build();

    private final ProtobufCodec<Timestamp, Timestamp> codec = new ProtobufCodec<>(Timestamp.parser());

    @Test
    void testEncodeWritesCanonicalBytes() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        codec.encoder().encode(SAMPLE, out);

        assertThat(out.toByteArray()).isEqualTo(SAMPLE.toByteArray());
        assertThat(codec.encoder().encode(SAMPLE)).isEqualTo(SAMPLE.toByteArray());
    }

    @Test
    void testDecodeEncodedMessage() {
        Optional<Timestamp> decoded = codec.decoder().decode(ByteBuffer.wrap(SAMPLE.toByteArray()));

        assertThat(decoded).contains(SAMPLE);
    }

    @Test
    void testReencodingDecodedBytesIsByteIdentical() {
        byte[] wire = SAMPLE.toByteArray();
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        codec.encoder().encode(codec.decoder().decode(wire).orElseThrow(), out);

        assertThat(out.toByteArray()).isEqualTo(wire);
    }

    @Test
    void testEncodeAndDecodeDifferentTypes() {
        ProtobufCodec<Duration, Timestamp> client = new ProtobufCodec<>(Timestamp.parser());
        Duration request = Duration.newBuilder().setSeconds(5).build();

        assertThat(client.encoder().encode(request)).isEqualTo(request.toByteArray());
        assertThat(client.decoder().decode(SAMPLE.toByteArray())).contains(SAMPLE);
    }

    @Test
    void testEmptyBufferDecodesToNothing() {
        assertThat(codec.decoder().decode(ByteBuffer.allocate(0))).isEmpty();
        assertThat(codec.decoder().decode((ByteBuffer) null)).isEmpty();
        assertThat(codec.decoder().decode(new byte[0])).isEmpty();
    }

    @Test
    void testDecodeLeavesBufferPositionUntouched() {
        ByteBuffer buf = ByteBuffer.wrap(SAMPLE.toByteArray());

        codec.decoder().decode(buf);

        assertThat(buf.position()).isZero();
        assertThat(buf.remaining()).isEqualTo(SAMPLE.getSerializedSize());
    }

    @Test
    void testDecodeOnlyRemainingBytes() {
        byte[] payload = SAMPLE.toByteArray();
        ByteBuffer buf = ByteBuffer.allocate(payload.length + 3);
        buf.put(new byte[] {0x00, 0x00, 0x00}).put(payload).flip();
        buf.position(3);

        assertThat(codec.decoder().decode(buf)).contains(SAMPLE);
    }

    @Test
    void testTruncatedInputIsInternal() {
        byte[] truncated = {0x0A, 0x05, 'a'};

        assertThatThrownBy(() -> codec.decoder().decode(truncated))
                .isInstanceOfSatisfying(StatusRuntimeException.class,
                        e -> assertThat(e.getStatus().getCode()).isEqualTo(Status.Code.INTERNAL))
                .hasCauseInstanceOf(InvalidProtocolBufferException.class);
    }

    @Test
    void testInvalidTagIsInternal() {
        assertThatThrownBy(() -> codec.decoder().decode(new byte[] {0x00}))
                .isInstanceOfSatisfying(StatusRuntimeException.class, e -> {
                    assertThat(e.getStatus().getCode()).isEqualTo(Status.Code.INTERNAL);
                    assertThat(e.getStatus().getDescription()).isNotBlank();
                });
    }

    @Test
    void testEncodeIntoFailingStreamIsFatal() {
        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("no space left");
            }

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                throw new IOException("no space left");
            }
        };

        assertThatThrownBy(() -> codec.encoder().encode(SAMPLE, broken))
                .isInstanceOf(IllegalStateException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void testCodecIsSharedAcrossThreads() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Timestamp>> tasks = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                Timestamp value = Timestamp.newBuilder().setSeconds(i).build();
                tasks.add(() -> {
                    ByteArrayOutputStream out = new ByteArrayOutputStream();
                    codec.encoder().encode(value, out);
                    return codec.decoder().decode(out.toByteArray()).orElse(Timestamp.getDefaultInstance());
                });
            }

            List<Future<Timestamp>> results = executor.invokeAll(tasks);
            for (int i = 0; i < results.size(); i++) {
                assertThat(results.get(i).get().getSeconds()).isEqualTo(i);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
