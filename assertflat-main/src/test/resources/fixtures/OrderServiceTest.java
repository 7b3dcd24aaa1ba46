package com.example.orders;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class OrderServiceTest {

    @Test
    void totals() {
        int quantity = 3;
        double price = 9.99;
        double total = price * quantity;
        String reference = "ORD-001";

        assertThat(quantity).isEqualTo(3);
        assertThat(quantity).as("quantity").isPositive();
        assertThat(total).isCloseTo(29.97, within(0.001));
        assertThat(reference).startsWith("ORD-");
        assertThat(reference).isNotNull();
    }

    @Test
    void lines() {
        List<String> skus = List.of("A-1", "B-2");

        assertThat(skus).hasSize(2);
        assertThat(skus).containsExactly("A-1", "B-2");
        assertThat(skus).isNotEmpty();
        skus.forEach(sku -> assertThat(sku).isNotNull());
    }

    @Test
    void failures() {
        assertThatThrownBy(() -> Integer.parseInt("x")).isInstanceOf(NumberFormatException.class);
        assertThatIllegalArgumentException().isThrownBy(() -> Integer.parseInt("y"));
        assertThatCode(() -> Integer.parseInt("1")).doesNotThrowAnyException();
    }

    @Test
    void confirmation() {
        CompletableFuture<String> confirmed = CompletableFuture.completedFuture("ok");

        assertThat(confirmed).succeedsWithin(Duration.ofSeconds(1)).isEqualTo("ok");
    }

    @Test
    void picking() {
        List<Line> lines = List.of(new Line("A-1"), new Line("B-2"));
        Optional<String> firstSku = lines.stream().map(Line::getSku).findFirst();
        List<String> picked = List.of();
        if (!lines.isEmpty()) {
            picked = List.of("A-1", "B-2");
        }

        assertThat(lines.get(0)).extracting(Line::getSku).isEqualTo("A-1");
        assertThat(lines).extracting(Line::getSku).contains("A-1");
        assertThat(firstSku).contains("A-1");
        assertThat(picked).contains("A-1", "B-2");
    }

    static final class Line {

        private final String sku;

        Line(String sku) {
            this.sku = sku;
        }

        String getSku() {
            return sku;
        }
    }
}
