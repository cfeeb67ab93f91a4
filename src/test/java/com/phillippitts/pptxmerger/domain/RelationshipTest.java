package com.phillippitts.pptxmerger.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RelationshipTest {

    private static final String IMAGE = "http://schemas.openxmlformats.org/officeDocument/2006/relationships/image";

    @Test
    void relativeTargetIsInternal() {
        assertThat(new Relationship("rId1", IMAGE, "../media/image1.png", null).isInternal()).isTrue();
    }

    @Test
    void absolutePackageTargetIsInternal() {
        assertThat(new Relationship("rId1", IMAGE, "/ppt/media/image1.png", null).isInternal()).isTrue();
    }

    @Test
    void externalModeIsNotInternal() {
        assertThat(new Relationship("rId1", IMAGE, "image.png", "External").isInternal()).isFalse();
    }

    @Test
    void uriSchemeIsNotInternal() {
        assertThat(new Relationship("rId1", IMAGE, "https://example.com/a.png", null).isInternal()).isFalse();
        assertThat(new Relationship("rId1", IMAGE, "mailto:someone@example.com", null).isInternal()).isFalse();
    }

    @Test
    void blankTargetIsNotInternal() {
        assertThat(new Relationship("rId1", IMAGE, "", null).isInternal()).isFalse();
        assertThat(new Relationship("rId1", IMAGE, null, null).isInternal()).isFalse();
    }

    @Test
    void requiresId() {
        assertThatThrownBy(() -> new Relationship(null, IMAGE, "a", null))
                .isInstanceOf(NullPointerException.class);
    }
}
