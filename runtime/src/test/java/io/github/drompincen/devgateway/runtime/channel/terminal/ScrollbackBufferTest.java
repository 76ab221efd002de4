package io.github.drompincen.devgateway.runtime.channel.terminal;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScrollbackBufferTest {

    @Test
    void appendsUntilTheCap() {
        ScrollbackBuffer buffer = new ScrollbackBuffer(10);
        buffer.append("abc");
        buffer.append("def");

        assertThat(buffer.contents()).isEqualTo("abcdef");
    }

    @Test
    void overflowDropsTheOldestCharacters() {
        ScrollbackBuffer buffer = new ScrollbackBuffer(10);
        buffer.append("0123456789");
        buffer.append("abc");

        assertThat(buffer.contents()).isEqualTo("3456789abc");
        assertThat(buffer.length()).isEqualTo(10);
    }

    @Test
    void chunkLargerThanTheCapKeepsItsTail() {
        ScrollbackBuffer buffer = new ScrollbackBuffer(4);
        buffer.append("xy");
        buffer.append("abcdefgh");

        assertThat(buffer.contents()).isEqualTo("efgh");
    }

    @Test
    void previewIsTheLastNonBlankLineWithoutColors() {
        ScrollbackBuffer buffer = new ScrollbackBuffer(1000);
        buffer.append("first\r\n\u001B[32muser@host\u001B[0m:~$ ls\n\n  \n");

        assertThat(buffer.preview()).isEqualTo("user@host:~$ ls");
    }

    @Test
    void previewIsCutToEightyCharacters() {
        ScrollbackBuffer buffer = new ScrollbackBuffer(1000);
        buffer.append("y".repeat(120));

        assertThat(buffer.preview()).hasSize(80);
    }

    @Test
    void emptyBufferHasEmptyPreview() {
        assertThat(new ScrollbackBuffer(10).preview()).isEmpty();
    }
}
