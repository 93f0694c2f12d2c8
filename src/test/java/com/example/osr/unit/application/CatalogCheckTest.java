package com.example.osr.unit.application;

import com.example.osr.application.port.out.CatalogLookupPort;
import com.example.osr.application.port.out.CatalogLookupPort.CatalogDescriptor;
import com.example.osr.application.service.CatalogCheck;
import com.example.osr.domain.document.OrderSpec;
import com.example.osr.domain.exception.OrderValidationException;
import com.example.osr.domain.model.OrderKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Catalog Check Tests")
class CatalogCheckTest {

    @Mock
    private CatalogLookupPort catalog;

    @Test
    @DisplayName("should_accept_known_codes")
    void should_accept_known_codes() {
        // Given
        CatalogCheck check = new CatalogCheck(Optional.of(catalog));
        when(catalog.lookup("A100")).thenReturn(Optional.of(new CatalogDescriptor("A100", "Bolt")));

        // When & Then
        assertThatCode(() -> check.verify(OrderSpec.builder(OrderKind.INVENTORY)
                .field("item", " A100 ")
                .field("location", "L01")
                .build())).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should_name_line_with_unknown_code")
    void should_name_line_with_unknown_code() {
        // Given
        CatalogCheck check = new CatalogCheck(Optional.of(catalog));
        when(catalog.lookup("A100")).thenReturn(Optional.of(new CatalogDescriptor("A100", "Bolt")));
        when(catalog.lookup("Z999")).thenReturn(Optional.empty());
        OrderSpec spec = OrderSpec.builder(OrderKind.STANDARD)
                .field("location", "L01")
                .line(Map.of("item", "A100", "qty", "1"))
                .line(Map.of("item", "Z999", "qty", "1"))
                .build();

        // When & Then
        assertThatThrownBy(() -> check.verify(spec))
                .isInstanceOfSatisfying(OrderValidationException.class, e -> {
                    assertThat(e.getField()).isEqualTo("lines[1].item");
                    assertThat(e.getReason()).contains("Z999");
                });
    }

    @Test
    @DisplayName("should_skip_check_without_catalog")
    void should_skip_check_without_catalog() {
        // Given
        CatalogCheck check = new CatalogCheck(Optional.empty());

        // When & Then
        assertThatCode(() -> check.verify(OrderSpec.builder(OrderKind.INVENTORY)
                .field("item", "ANY")
                .build())).doesNotThrowAnyException();
        verifyNoInteractions(catalog);
    }
}
