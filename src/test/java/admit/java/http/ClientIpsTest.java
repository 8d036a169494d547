package admit.java.http;

import jakarta.servlet.http.HttpServletRequest;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ClientIpsTest {

    @Test
    void testResolvedAttribute_winsOverSocketAddress() {
        HttpServletRequest request = mock(HttpServletRequest.class);
        when(request.getAttribute(ClientIps.CLIENT_IP_ATTRIBUTE)).thenReturn("203.0.113.7");
        when(request.getRemoteAddr()).thenReturn("10.0.0.1");

        assertEquals("203.0.113.7", ClientIps.resolve(request));
    }

    @Test
    void testFallsBackToRemoteAddress() {
        HttpServletRequest request = mock(HttpServletRequest.class);
        when(request.getRemoteAddr()).thenReturn("10.0.0.1");

        assertEquals("10.0.0.1", ClientIps.resolve(request));
    }

    @Test
    void testFallsBackToUnknown() {
        HttpServletRequest request = mock(HttpServletRequest.class);
        when(request.getAttribute(ClientIps.CLIENT_IP_ATTRIBUTE)).thenReturn(" ");

        assertEquals("unknown", ClientIps.resolve(request));
    }

    @Test
    void testForwardedHeaderIsNotTrusted() {
        HttpServletRequest request = mock(HttpServletRequest.class);
        when(request.getHeader("X-Forwarded-For")).thenReturn("6.6.6.6");
        when(request.getRemoteAddr()).thenReturn("10.0.0.1");

        assertEquals("10.0.0.1", ClientIps.resolve(request));
    }
}
