package com.walletscore.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageRequestTest {

    private static final String WALLET = "0x742d35Cc6634C0532925a3b844Bc454e4438f44e";

    @Test
    @DisplayName("last window page stays within the 10,000-row ceiling")
    void lastPageWithinCeiling() {
        PageRequest last = PageRequest.windowPage(ActivityCategory.TOKEN, WALLET, PageRequest.MAX_PAGES, SortOrder.DESC);

        assertThat((long) last.page() * last.pageSize()).isEqualTo(PageRequest.RESULT_CEILING);
    }

    @Test
    @DisplayName("page past the ceiling is rejected")
    void pagePastCeilingRejected() {
        assertThatThrownBy(() -> PageRequest.windowPage(ActivityCategory.NATIVE, WALLET, 11, SortOrder.DESC))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ceiling");
    }

    @Test
    @DisplayName("first-activity lookup is one ascending native row")
    void firstActivityShape() {
        PageRequest request = PageRequest.firstActivity(WALLET);

        assertThat(request.category()).isEqualTo(ActivityCategory.NATIVE);
        assertThat(request.page()).isEqualTo(1);
        assertThat(request.pageSize()).isEqualTo(1);
        assertThat(request.sort()).isEqualTo(SortOrder.ASC);
    }
}
