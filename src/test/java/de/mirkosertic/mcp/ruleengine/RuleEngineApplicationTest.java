package de.mirkosertic.mcp.ruleengine;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.ProtocolVersions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RuleEngineApplication Tests")
class RuleEngineApplicationTest {

    @Test
    @DisplayName("STDIO transport should offer the newest protocol revision first")
    void shouldAdvertiseNewerProtocolVersions() {
        final StdioServerTransportProvider transport =
                RuleEngineApplication.stdioTransport(new JacksonMcpJsonMapper(new ObjectMapper()));

        assertThat(transport.protocolVersions()).containsExactly(
                ProtocolVersions.MCP_2025_06_18,
                ProtocolVersions.MCP_2025_03_26,
                ProtocolVersions.MCP_2024_11_05);
    }
}
