package com.openrangelabs.pmpulse.ingestion.handler;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StatusVocabularyTest {

    @Test
    void unitStatus_MapsRemoteLabels() {
        assertThat(StatusVocabulary.unitStatus("Rented")).isEqualTo("occupied");
        assertThat(StatusVocabulary.unitStatus(" available ")).isEqualTo("vacant");
        assertThat(StatusVocabulary.unitStatus("Not Ready")).isEqualTo("not_ready");
        assertThat(StatusVocabulary.unitStatus("something else")).isEqualTo("vacant");
        assertThat(StatusVocabulary.unitStatus(null)).isEqualTo("vacant");
    }

    @Test
    void leaseStatus_MapsRemoteLabels() {
        assertThat(StatusVocabulary.leaseStatus("Current")).isEqualTo("active");
        assertThat(StatusVocabulary.leaseStatus("Notice")).isEqualTo("active");
        assertThat(StatusVocabulary.leaseStatus("Evict")).isEqualTo("past");
        assertThat(StatusVocabulary.leaseStatus("Future")).isEqualTo("future");
    }

    @Test
    void workOrderStatusAndPriority_FallBackToDefaults() {
        assertThat(StatusVocabulary.workOrderStatus("Assigned")).isEqualTo("in_progress");
        assertThat(StatusVocabulary.workOrderStatus("Canceled")).isEqualTo("cancelled");
        assertThat(StatusVocabulary.workOrderStatus("???")).isEqualTo("open");
        assertThat(StatusVocabulary.priority("Urgent")).isEqualTo("high");
        assertThat(StatusVocabulary.priority("Critical")).isEqualTo("emergency");
        assertThat(StatusVocabulary.priority(null)).isEqualTo("normal");
    }
}
