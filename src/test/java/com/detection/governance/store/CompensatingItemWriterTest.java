package com.detection.governance.store;

import com.detection.governance.exception.DuplicateItemIdException;
import com.detection.governance.exception.StoreWriteException;
import com.detection.governance.model.ContentItem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompensatingItemWriterTest {

    @Mock
    private ContentItemStore store;

    @InjectMocks
    private CompensatingItemWriter writer;

    private final ContentItem created = ContentItem.builder().id("NEW").version(1).build();
    private final ContentItem before = ContentItem.builder().id("SRC").version(3).build();
    private final ContentItem after = ContentItem.builder().id("SRC").version(4).build();
    private final ContentItem third = ContentItem.builder().id("DEP").version(2).build();

    @Test
    void appliesAllWritesInOrder() {
        when(store.insert(created)).thenReturn(true);

        writer.apply(List.of(ItemWrite.create(created), ItemWrite.update(before, after), ItemWrite.delete(third)));

        InOrder order = inOrder(store);
        order.verify(store).insert(created);
        order.verify(store).put(after);
        order.verify(store).delete("DEP");
    }

    @Test
    void failureUndoesAppliedWritesInReverse() {
        when(store.insert(created)).thenReturn(true);
        lenient().doThrow(new IllegalStateException("timeout")).when(store).delete("DEP");

        assertThatThrownBy(() -> writer.apply(List.of(
                ItemWrite.create(created), ItemWrite.update(before, after), ItemWrite.delete(third))))
                .isInstanceOf(StoreWriteException.class)
                .hasMessageContaining("DEP")
                .hasCauseInstanceOf(IllegalStateException.class)
                .satisfies(ex -> assertThat(ex.getSuppressed()).isEmpty());

        InOrder order = inOrder(store);
        order.verify(store).insert(created);
        order.verify(store).put(after);
        order.verify(store).delete("DEP");
        order.verify(store).put(before);
        order.verify(store).delete("NEW");
        verify(store, never()).put(third);
    }

    @Test
    void rollbackFailuresAreAttachedAsSuppressed() {
        when(store.insert(created)).thenReturn(true);
        lenient().doThrow(new IllegalStateException("timeout")).when(store).put(after);
        lenient().doThrow(new IllegalStateException("still down")).when(store).delete("NEW");

        assertThatThrownBy(() -> writer.apply(List.of(ItemWrite.create(created), ItemWrite.update(before, after))))
                .isInstanceOf(StoreWriteException.class)
                .hasRootCauseMessage("timeout")
                .satisfies(ex -> assertThat(ex.getSuppressed()).singleElement()
                        .extracting(Throwable::getMessage).isEqualTo("still down"));

        verify(store).delete("NEW");
    }

    @Test
    void takenIdFailsCreateWithoutOverwriting() {
        when(store.insert(created)).thenReturn(false);

        assertThatThrownBy(() -> writer.apply(List.of(ItemWrite.create(created), ItemWrite.update(before, after))))
                .isInstanceOf(DuplicateItemIdException.class)
                .hasMessageContaining("NEW");

        verify(store, never()).put(created);
        verify(store, never()).put(after);
        verify(store, never()).delete("NEW");
    }

    @Test
    void takenIdLaterInGroupUndoesEarlierSteps() {
        ContentItem second = ContentItem.builder().id("NEW2").version(1).build();
        when(store.insert(created)).thenReturn(true);
        when(store.insert(second)).thenReturn(false);

        assertThatThrownBy(() -> writer.apply(List.of(ItemWrite.create(created), ItemWrite.create(second))))
                .isInstanceOf(DuplicateItemIdException.class)
                .extracting(ex -> ((DuplicateItemIdException) ex).getItemId())
                .isEqualTo("NEW2");

        verify(store).delete("NEW");
        verify(store, never()).delete("NEW2");
    }
}
