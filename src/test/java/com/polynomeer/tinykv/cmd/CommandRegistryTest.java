package com.polynomeer.tinykv.cmd;

import com.polynomeer.tinykv.db.Key;
import com.polynomeer.tinykv.db.MemoryDb;
import com.polynomeer.tinykv.resp.CommandError;
import com.polynomeer.tinykv.resp.RespValue;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandRegistryTest {

    private final MemoryDb db = new MemoryDb();
    private final CommandRegistry registry = CommandRegistry.withDefaults(db);

    private static RespValue request(Object... parts) {
        return RespValue.of(Arrays.asList(parts));
    }

    private static RespValue bulk(String s) {
        return RespValue.BulkString.of(s);
    }

    private static RespValue integer(long n) {
        return new RespValue.RespInteger(n);
    }

    @Test
    void shouldRegisterTheStoreCommands() {
        assertThat(registry.names()).containsExactlyInAnyOrder("GET", "SET", "DELETE", "FLUSH", "MGET", "MSET");
    }

    @Nested
    class RequestShape {

        @Test
        void shouldAcceptArrayRequest() {
            assertThat(registry.dispatch(request("SET", "foo", "bar"))).isEqualTo(integer(1));
            assertThat(registry.dispatch(request("GET", "foo"))).isEqualTo(bulk("bar"));
        }

        @Test
        void shouldSplitSimpleStringShorthand() {
            registry.dispatch(RespValue.SimpleString.of("  set   foo\tbar "));

            assertThat(registry.dispatch(RespValue.SimpleString.of("GET foo"))).isEqualTo(bulk("bar"));
        }

        @Test
        void shouldMatchCommandNamesCaseInsensitively() {
            assertThat(registry.dispatch(request("sEt", "k", "v"))).isEqualTo(integer(1));
            assertThat(registry.dispatch(request("get", "k"))).isEqualTo(bulk("v"));
        }

        @Test
        void shouldRejectOtherRequestTypes() {
            assertThatThrownBy(() -> registry.dispatch(integer(5)))
                    .isInstanceOf(CommandError.class)
                    .hasMessage("Request must be list or simple string");
            assertThatThrownBy(() -> registry.dispatch(bulk("GET foo")))
                    .isInstanceOf(CommandError.class);
        }

        @Test
        void shouldRejectEmptyRequest() {
            assertThatThrownBy(() -> registry.dispatch(request()))
                    .isInstanceOf(CommandError.class)
                    .hasMessage("Missing command");
            assertThatThrownBy(() -> registry.dispatch(RespValue.SimpleString.of("   ")))
                    .isInstanceOf(CommandError.class)
                    .hasMessage("Missing command");
        }

        @Test
        void shouldRejectUnknownCommand() {
            assertThatThrownBy(() -> registry.dispatch(request("frobnicate", "x")))
                    .isInstanceOf(CommandError.class)
                    .hasMessage("Unrecognized command: FROBNICATE");
        }

        @Test
        void shouldRejectNonStringCommandName() {
            assertThatThrownBy(() -> registry.dispatch(request(7L, "x")))
                    .isInstanceOf(CommandError.class);
        }

        @Test
        void shouldTurnCommandErrorIntoErrorReply() {
            RespValue reply = registry.respond(request("NOPE"));

            assertThat(reply).isEqualTo(new RespValue.ErrorReply("Unrecognized command: NOPE"));
        }
    }

    @Nested
    class StoreCommandBehaviour {

        @Test
        void shouldReturnNullBulkForMissingKey() {
            assertThat(registry.dispatch(request("GET", "missing"))).isEqualTo(RespValue.BulkString.NULL);
        }

        @Test
        void shouldReportDeleteOutcome() {
            assertThat(registry.dispatch(request("DELETE", "absent"))).isEqualTo(integer(0));

            registry.dispatch(request("SET", "k", "v"));
            assertThat(registry.dispatch(request("DELETE", "k"))).isEqualTo(integer(1));
            assertThat(registry.dispatch(request("GET", "k"))).isEqualTo(RespValue.BulkString.NULL);
        }

        @Test
        void shouldFlushAndCount() {
            assertThat(registry.dispatch(request("FLUSH"))).isEqualTo(integer(0));

            registry.dispatch(request("MSET", "a", "1", "b", "2"));
            assertThat(registry.dispatch(request("FLUSH"))).isEqualTo(integer(2));
            assertThat(db.size()).isZero();
        }

        @Test
        void shouldMgetInRequestedOrder() {
            registry.dispatch(request("SET", "a", "A"));
            registry.dispatch(request("SET", "c", "C"));

            RespValue reply = registry.dispatch(request("MGET", "a", "b", "c"));

            assertThat(reply).isEqualTo(RespValue.Array.of(bulk("A"), RespValue.BulkString.NULL, bulk("C")));
        }

        @Test
        void shouldAllowEmptyMgetAndMset() {
            assertThat(registry.dispatch(request("MGET"))).isEqualTo(new RespValue.Array(List.of()));
            assertThat(registry.dispatch(request("MSET"))).isEqualTo(integer(0));
        }

        @Test
        void shouldCountMsetPairs() {
            assertThat(registry.dispatch(request("MSET", "a", "1", "b", "2", "a", "3"))).isEqualTo(integer(3));
            assertThat(registry.dispatch(request("GET", "a"))).isEqualTo(bulk("3"));
        }

        @Test
        void shouldLeaveStoreUntouchedOnOddMset() {
            registry.dispatch(request("SET", "keep", "me"));

            assertThatThrownBy(() -> registry.dispatch(request("MSET", "keep", "changed", "dangling")))
                    .isInstanceOf(CommandError.class)
                    .hasMessage("MSET requires an even number of arguments");
            assertThat(db.size()).isEqualTo(1);
            assertThat(db.get(Key.of("keep"))).isEqualTo(bulk("me"));
        }

        @Test
        void shouldLeaveStoreUntouchedWhenLaterMsetKeyIsInvalid() {
            assertThatThrownBy(() -> registry.dispatch(request("MSET", "a", "1", 5L, "2")))
                    .isInstanceOf(CommandError.class)
                    .hasMessage("key must be a string");
            assertThat(db.size()).isZero();
        }

        @Test
        void shouldEnforceArity() {
            assertThatThrownBy(() -> registry.dispatch(request("GET")))
                    .isInstanceOf(CommandError.class)
                    .hasMessage("wrong number of arguments for 'GET'");
            assertThatThrownBy(() -> registry.dispatch(request("SET", "only-key")))
                    .isInstanceOf(CommandError.class)
                    .hasMessage("wrong number of arguments for 'SET'");
            assertThatThrownBy(() -> registry.dispatch(request("FLUSH", "extra")))
                    .isInstanceOf(CommandError.class)
                    .hasMessage("wrong number of arguments for 'FLUSH'");
        }

        @Test
        void shouldStoreBinaryValuesVerbatim() {
            byte[] blob = {0, 1, '\r', '\n', (byte) 0xfe};
            registry.dispatch(request("SET", "bin".getBytes(StandardCharsets.UTF_8), blob));

            assertThat(registry.dispatch(request("GET", "bin"))).isEqualTo(new RespValue.BulkString(blob));
        }
    }
}
