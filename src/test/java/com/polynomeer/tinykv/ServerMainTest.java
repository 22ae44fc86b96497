package com.polynomeer.tinykv;

import com.polynomeer.tinykv.net.ServerConfig;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;

class ServerMainTest {

    @Test
    void shouldUseDefaultsWithoutOptions() {
        ServerMain main = new ServerMain();
        new CommandLine(main).parseArgs();

        assertThat(main.config()).isEqualTo(ServerConfig.defaults());
    }

    @Test
    void shouldParseListenerOptions() {
        ServerMain main = new ServerMain();
        new CommandLine(main).parseArgs("--host", "0.0.0.0", "-p", "6380", "--max-clients", "8");

        assertThat(main.config()).isEqualTo(new ServerConfig("0.0.0.0", 6380, 8));
    }
}
