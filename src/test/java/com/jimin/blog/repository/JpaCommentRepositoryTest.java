package com.jimin.blog.repository;

import com.jimin.blog.entity.Comment;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class JpaCommentRepositoryTest {

    @Autowired
    private CommentRepository commentRepository;

    @Test
    void addThenGetByIdRoundTrips() {
        Comment comment = comment("Nice post!");

        commentRepository.add(comment).join();
        Optional<Comment> found = commentRepository.getById(comment.getId()).join();

        assertThat(found).isPresent();
        assertThat(found.get().getContent()).isEqualTo("Nice post!");
        assertThat(found.get().getAuthor()).isEqualTo("jimin");
        assertThat(found.get().getPostId()).isEqualTo(comment.getPostId());
        assertThat(found.get().getCreatedAt()).isNotNull();
    }

    @Test
    void getByIdCompletesEmptyForUnknownId() {
        assertThat(commentRepository.getById(UUID.randomUUID()).join()).isEmpty();
    }

    @Test
    void updatePersistsChanges() {
        Comment comment = commentRepository.add(comment("before edit")).join();
        Instant later = Instant.now().plus(1, ChronoUnit.MINUTES);

        comment.setContent("after edit");
        comment.markUpdated(later);
        commentRepository.update(comment).join();

        Comment reloaded = commentRepository.getById(comment.getId()).join().orElseThrow();
        assertThat(reloaded.getContent()).isEqualTo("after edit");
        assertThat(reloaded.getUpdatedAt()).isAfter(reloaded.getCreatedAt());
    }

    @Test
    void deleteRemovesRowAndToleratesRepeat() {
        Comment comment = commentRepository.add(comment("short lived")).join();

        commentRepository.delete(comment).join();
        commentRepository.delete(comment).join();

        assertThat(commentRepository.getById(comment.getId()).join()).isEmpty();
    }

    @Test
    void staleUpdateAfterDeleteDoesNotRestoreRow() {
        Comment comment = commentRepository.add(comment("will be deleted")).join();
        Comment loaded = commentRepository.getById(comment.getId()).join().orElseThrow();

        commentRepository.delete(commentRepository.getById(comment.getId()).join().orElseThrow()).join();
        loaded.setContent("edited");
        commentRepository.update(loaded).join();

        assertThat(commentRepository.getById(comment.getId()).join()).isEmpty();
    }

    @Test
    void updateByIdAppliesChangesInOneTransaction() {
        Comment comment = commentRepository.add(comment("before edit")).join();
        Instant later = comment.getCreatedAt().plus(1, ChronoUnit.MINUTES);

        boolean updated = commentRepository.updateById(comment.getId(), found -> {
            found.setContent("after edit");
            found.markUpdated(later);
        }).join();

        assertThat(updated).isTrue();
        Comment reloaded = commentRepository.getById(comment.getId()).join().orElseThrow();
        assertThat(reloaded.getContent()).isEqualTo("after edit");
        assertThat(reloaded.getUpdatedAt()).isAfter(reloaded.getCreatedAt());
    }

    @Test
    void updateByIdAfterDeleteReturnsFalseWithoutInsert() {
        Comment comment = commentRepository.add(comment("gone soon")).join();
        assertThat(commentRepository.deleteById(comment.getId()).join()).isTrue();

        boolean updated = commentRepository.updateById(comment.getId(), found -> found.setContent("edited")).join();

        assertThat(updated).isFalse();
        assertThat(commentRepository.getById(comment.getId()).join()).isEmpty();
    }

    @Test
    void deleteByIdSecondCallReturnsFalse() {
        Comment comment = commentRepository.add(comment("delete twice")).join();

        assertThat(commentRepository.deleteById(comment.getId()).join()).isTrue();
        assertThat(commentRepository.deleteById(comment.getId()).join()).isFalse();
    }

    @Test
    void getAllIncludesAddedComment() {
        Comment comment = commentRepository.add(comment("listed comment")).join();

        assertThat(commentRepository.getAll().join())
                .extracting(Comment::getId)
                .contains(comment.getId());
    }

    private static Comment comment(String content) {
        Comment comment = new Comment(Instant.now());
        comment.setPostId(UUID.randomUUID());
        comment.setAuthor("jimin");
        comment.setContent(content);
        return comment;
    }
}
