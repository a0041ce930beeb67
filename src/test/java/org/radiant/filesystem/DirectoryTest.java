package org.radiant.filesystem;

import org.radiant.error.DuplicateNameException;
import org.radiant.error.NotFoundException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectoryTest {

    private final FileSystem fs = FileSystem.withRootDirectory("test");
    private final Directory root = fs.getRootDirectory();

    @Test
    void addEntry_rejectsDuplicateNameAndKeepsListing() {
        Entry<File> original = fs.link(root, "x", fs.createFile(new byte[]{1}));
        File other = fs.createFile(new byte[]{2});
        Entry<File> duplicate = new Entry<>(fs, "x", other);

        assertThatThrownBy(() -> root.addEntry(duplicate)).isInstanceOf(DuplicateNameException.class);

        assertThat(root.getEntries()).containsExactly(original);
        assertThat(root.getEntry("x")).isSameAs(original);
        assertThat(duplicate.getParent()).isEmpty();
    }

    @Test
    void addEntry_setsParent() {
        Directory sub = fs.createDirectory();
        Entry<Directory> entry = new Entry<>(fs, "sub", sub);

        root.addEntry(entry);

        assertThat(entry.getParent()).contains(root);
        assertThat(entry.isDirectory()).isTrue();
        assertThat(entry.isFile()).isFalse();
    }

    @Test
    void removeEntry_doesNotTouchReferenceCount() {
        File f = fs.createFile(new byte[0]);
        Entry<File> entry = fs.link(root, "f", f);

        assertThat(root.removeEntry("f")).isSameAs(entry);

        assertThat(root.containsEntry("f")).isFalse();
        assertThat(entry.getParent()).isEmpty();
        assertThat(f.getReferences()).isEqualTo(1);
        assertThat(fs.containsEntry(entry.getId())).isTrue();
    }

    @Test
    void lookups_failWithNotFound() {
        assertThatThrownBy(() -> root.getEntry("nope")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> root.removeEntry("nope")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void getEntries_keepsInsertionOrder() {
        fs.link(root, "b", fs.createFile(new byte[0]));
        fs.link(root, "a", fs.createFile(new byte[0]));
        fs.link(root, "c", fs.createDirectory());

        assertThat(root.getEntries()).extracting(Entry::getName).containsExactly("b", "a", "c");
        assertThat(root.isEmpty()).isFalse();
        assertThat(root.listingFileSystem()).isSameAs(fs);
    }

    @Test
    void file_readAndWriteCopyContent() {
        byte[] initial = {1, 2, 3};
        File f = fs.createFile(initial);
        initial[0] = 9;

        assertThat(f.read()).containsExactly(1, 2, 3);

        byte[] read = f.read();
        read[0] = 9;
        assertThat(f.read()).containsExactly(1, 2, 3);

        f.write(new byte[]{4});
        assertThat(f.size()).isEqualTo(1);
        f.write(null);
        assertThat(f.size()).isZero();
    }

    @Test
    void constructor_listsGivenEntriesInOrder() {
        Entry<File> a = new Entry<>(fs, "a", fs.createFile(new byte[0]));
        Entry<File> b = new Entry<>(fs, "b", fs.createFile(new byte[0]));

        Directory dir = new Directory(fs, List.of(a, b));

        assertThat(dir.getEntries()).containsExactly(a, b);
        assertThat(a.getParent()).contains(dir);
        assertThat(fs.containsEntry(a.getId())).isFalse();
        assertThatThrownBy(() -> new Directory(fs, List.of(a, new Entry<>(fs, "a", fs.createFile(new byte[0])))))
                .isInstanceOf(DuplicateNameException.class);
    }

    @Test
    void entry_presetParentIsOnlyALink() {
        File f = fs.createFile(new byte[0]);
        Entry<File> entry = new Entry<>(fs, "f", f, root);

        assertThat(entry.getParent()).contains(root);
        assertThat(root.containsEntry("f")).isFalse();

        root.addEntry(entry);
        fs.addEntry(entry);
        assertThat(f.getReferences()).isEqualTo(1);
    }

    @Test
    void entry_typedNodeLookup() {
        File f = fs.createFile(new byte[]{1});
        Entry<File> entry = fs.link(root, "f", f);

        assertThat(entry.getNode(File.class)).isSameAs(f);
        assertThat(entry.getNode()).isSameAs(f);
        assertThatThrownBy(() -> entry.getNode(Directory.class)).isInstanceOf(IllegalArgumentException.class);
    }
}
