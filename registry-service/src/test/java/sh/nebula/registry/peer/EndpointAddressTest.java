package sh.nebula.registry.peer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EndpointAddressTest {

    @Test
    void parsesFullEndpoint() {
        assertThat(EndpointAddress.parse("https://dash.example.net:8443/api/registry"))
                .contains(new EndpointAddress("https", "dash.example.net", 8443));
    }

    @Test
    void defaultsSchemeAndPort() {
        EndpointAddress address = EndpointAddress.parse("home.lan").orElseThrow();

        assertThat(address.protocol()).isEqualTo("http");
        assertThat(address.port()).isEqualTo(80);
        assertThat(address.toUrl()).isEqualTo("http://home.lan:80");
    }

    @Test
    void rejectsBlankInput() {
        assertThat(EndpointAddress.parse(null)).isEmpty();
        assertThat(EndpointAddress.parse("  ")).isEmpty();
        assertThat(EndpointAddress.parse("://")).isEmpty();
        assertThatThrownBy(() -> EndpointAddress.http(" ", 80)).isInstanceOf(IllegalArgumentException.class);
    }
}
