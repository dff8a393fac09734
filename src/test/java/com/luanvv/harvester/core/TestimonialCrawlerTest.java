package com.luanvv.harvester.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.luanvv.harvester.model.Testimonial;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TestimonialCrawlerTest {
    private static final String PAGE = Fixtures.BASE + "/testimonials";
    private static final String FRAGMENT_2 = Fixtures.BASE + "/api/testimonials?page=2";
    private static final String FRAGMENT_3 = Fixtures.BASE + "/api/testimonials?page=3";

    @Mock
    private Transport transport;

    private Config config;

    @BeforeEach
    void setUp() {
        config = Fixtures.config();
    }

    private TestimonialCrawler crawler() {
        return new TestimonialCrawler(config, transport, new RateLimiter(config.getRateLimit()),
                new Retryer(config.getRetries()), new Extractor(config.getBaseUrl()));
    }

    private void serveChain() {
        when(transport.fetchHtml(eq(PAGE), anyMap())).thenReturn(Fixtures.read("testimonials.html"));
        when(transport.fetchHtml(eq(FRAGMENT_2), anyMap())).thenReturn(Fixtures.read("testimonials-page2.html"));
        when(transport.fetchHtml(eq(FRAGMENT_3), anyMap())).thenReturn(Fixtures.read("testimonials-page3.html"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void followsFragmentLinksWithTokenOnEveryRequest() {
        serveChain();

        crawler().crawl();

        ArgumentCaptor<Map<String, String>> headers = ArgumentCaptor.forClass(Map.class);
        verify(transport).fetchHtml(eq(PAGE), anyMap());
        verify(transport).fetchHtml(eq(FRAGMENT_2), headers.capture());
        verify(transport).fetchHtml(eq(FRAGMENT_3), headers.capture());
        verify(transport, times(3)).fetchHtml(anyString(), anyMap());

        assertThat(headers.getAllValues()).hasSize(2).allSatisfy(h -> assertThat(h)
                .containsEntry("x-secret-token", "secret-from-page")
                .containsEntry("HX-Request", "true")
                .containsEntry("X-Requested-With", "XMLHttpRequest")
                .containsEntry("Referer", PAGE));
    }

    @Test
    void dropsExactDuplicatesButKeepsDifferentRatings() {
        serveChain();

        List<Testimonial> testimonials = crawler().crawl();

        assertThat(testimonials).containsExactly(
                new Testimonial("alice", "We love this shop!", 5),
                new Testimonial("", "Fast shipping.", 4),
                new Testimonial("bob", "Great support.", 5),
                new Testimonial("carol", "Would buy again.", 3),
                new Testimonial("bob", "Great support.", 4),
                new Testimonial("dave", "Decent.", 0));
    }

    @Test
    void fallsBackToConfiguredTokenWhenPageEmbedsNone() {
        when(transport.fetchHtml(eq(PAGE), anyMap())).thenReturn(Fixtures.read("testimonials-no-token.html"));
        when(transport.fetchHtml(eq(FRAGMENT_2), anyMap())).thenReturn(Fixtures.read("testimonials-page3.html"));

        List<Testimonial> testimonials = crawler().crawl();

        verify(transport).fetchHtml(eq(FRAGMENT_2), eq(crawler().fragmentHeaders(PAGE, "secret123")));
        assertThat(testimonials).hasSize(3);
    }

    @Test
    void noTokenAnywhereIsAContractViolation() {
        config.getTestimonials().setSecretToken(null);
        when(transport.fetchHtml(eq(PAGE), anyMap())).thenReturn(Fixtures.read("testimonials-no-token.html"));

        assertThatThrownBy(() -> crawler().crawl())
                .isInstanceOf(ProtocolContractException.class)
                .hasMessageContaining("secret token")
                .hasFieldOrPropertyWithValue("payload", null);
    }

    @Test
    void rejectedFragmentRequestReportsContractChange() {
        when(transport.fetchHtml(eq(PAGE), anyMap())).thenReturn(Fixtures.read("testimonials.html"));
        when(transport.fetchHtml(eq(FRAGMENT_2), anyMap()))
                .thenThrow(new TransportException(FRAGMENT_2, 422, "Unprocessable Entity"));

        assertThatThrownBy(() -> crawler().crawl())
                .isInstanceOf(ProtocolContractException.class)
                .hasMessageContaining("contract changed")
                .hasMessageContaining("422")
                .hasCauseInstanceOf(TransportException.class);
    }

    @Test
    void serverFaultOnFragmentStaysATransportError() {
        when(transport.fetchHtml(eq(PAGE), anyMap())).thenReturn(Fixtures.read("testimonials.html"));
        when(transport.fetchHtml(eq(FRAGMENT_2), anyMap()))
                .thenThrow(new TransportException(FRAGMENT_2, 500, "oops"));

        assertThatThrownBy(() -> crawler().crawl())
                .isExactlyInstanceOf(TransportException.class);
    }

    @Test
    void fragmentWithoutTestimonialsIsAContractViolation() {
        when(transport.fetchHtml(eq(PAGE), anyMap())).thenReturn(Fixtures.read("testimonials.html"));
        when(transport.fetchHtml(eq(FRAGMENT_2), anyMap())).thenReturn(Fixtures.read("testimonials-broken.html"));

        assertThatThrownBy(() -> crawler().crawl())
                .isInstanceOf(ProtocolContractException.class)
                .hasMessageContaining("div.testimonial");
    }

    @Test
    void fragmentCapStopsTheChain() {
        config.getTestimonials().setMaxPages(1);
        when(transport.fetchHtml(eq(PAGE), anyMap())).thenReturn(Fixtures.read("testimonials.html"));
        when(transport.fetchHtml(eq(FRAGMENT_2), anyMap())).thenReturn(Fixtures.read("testimonials-page2.html"));

        List<Testimonial> testimonials = crawler().crawl();

        assertThat(testimonials).hasSize(4);
        verify(transport, times(2)).fetchHtml(anyString(), anyMap());
    }
}
