package dev.mirror.controller;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GitUrlsTest {

    @Test
    void treePageYieldsRepositoryAndBranch() {
        GitUrls.GitUrl parsed = GitUrls.parse("https://github.com/octo/hello/tree/develop");

        assertThat(parsed.url()).isEqualTo("https://github.com/octo/hello.git");
        assertThat(parsed.branch()).isEqualTo("develop");
    }

    @Test
    void giteeTreePageIsRecognized() {
        GitUrls.GitUrl parsed = GitUrls.parse("https://gitee.com/octo/hello/tree/master/src");

        assertThat(parsed.url()).isEqualTo("https://gitee.com/octo/hello.git");
        assertThat(parsed.branch()).isEqualTo("master");
    }

    @Test
    void bareRepositoryUrlGetsSuffix() {
        assertThat(GitUrls.parse("  https://github.com/octo/hello ").url()).isEqualTo("https://github.com/octo/hello.git");
        assertThat(GitUrls.parse("https://github.com/octo/hello").branch()).isNull();
    }

    @Test
    void otherUrlsPassThrough() {
        assertThat(GitUrls.parse("https://github.com/octo/hello.git").url()).isEqualTo("https://github.com/octo/hello.git");
        assertThat(GitUrls.parse("https://gitlab.com/octo/hello").url()).isEqualTo("https://gitlab.com/octo/hello");
        assertThat(GitUrls.parse("https://github.com/octo/hello/issues/3").url())
            .isEqualTo("https://github.com/octo/hello/issues/3");
    }
}
