package org.radiant.filesystem;

import org.radiant.error.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemTest {

    private FileSystem fs;
    private Directory root;

    @BeforeEach
    void setUp() {
        fs = new FileSystem("test");
        root = new Directory(fs);
        fs.addNode(root);
        Entry<Directory> rootEntry = new Entry<>(fs, "/", root);
        fs.addEntry(rootEntry);
        fs.setRoot(rootEntry);
    }

    @Test
    void removeEntry_lastReferenceDestroysNodeAndDetachesFromDirectory() {
        File f = new File(fs, new byte[]{0x41, 0x42});
        fs.addNode(f);
        Entry<File> e = new Entry<>(fs, "a.txt", f, root);
        root.addEntry(e);
        fs.addEntry(e);

        assertThat(f.getReferences()).isEqualTo(1);

        fs.removeEntry(e.getId());

        assertThat(fs.containsNode(f.getId())).isFalse();
        assertThatThrownBy(() -> fs.getNode(f.getId())).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> root.getEntry("a.txt")).isInstanceOf(NotFoundException.class);
        assertThat(e.getParent()).isEmpty();
    }

    @Test
    void referenceCount_tracksRegisteredEntries() {
        File f = fs.createFile(new byte[]{1});
        Entry<File> first = fs.link(root, "one", f);
        Entry<File> second = fs.link(root, "two", f);
        Entry<File> unregistered = new Entry<>(fs, "three", f);

        assertThat(f.getReferences()).isEqualTo(2);
        assertThat(countEntriesTargeting(f)).isEqualTo(2);

        root.addEntry(unregistered);
        assertThat(f.getReferences()).isEqualTo(2);

        fs.removeEntry(first.getId());
        assertThat(f.getReferences()).isEqualTo(1);
        assertThat(countEntriesTargeting(f)).isEqualTo(1);
        assertThat(fs.containsNode(f.getId())).isTrue();

        fs.removeEntry(second.getId());
        assertThat(fs.containsNode(f.getId())).isFalse();
    }

    @Test
    void node_withoutEntriesIsNeverCollected() {
        File orphan = fs.createFile(new byte[0]);
        File other = fs.createFile(new byte[0]);
        Entry<File> entry = fs.link(root, "other", other);

        fs.removeEntry(entry.getId());

        assertThat(orphan.getReferences()).isZero();
        assertThat(fs.getNode(orphan.getId())).isSameAs(orphan);
    }

    @Test
    void nodeRemove_leavesEntriesDangling() {
        File f = fs.createFile(new byte[]{7});
        Entry<File> entry = fs.link(root, "f", f);

        f.remove();

        assertThat(fs.containsNode(f.getId())).isFalse();
        assertThat(fs.getEntry(entry.getId())).isSameAs(entry);
        assertThat(root.getEntry("f")).isSameAs(entry);
        assertThatThrownBy(() -> entry.getNode()).isInstanceOf(NotFoundException.class);

        // 悬空条目仍可注销，只是不再通知节点
        fs.removeEntry(entry.getId());
        assertThat(fs.containsEntry(entry.getId())).isFalse();
        assertThat(root.containsEntry("f")).isFalse();
    }

    @Test
    void lookups_failWithNotFound() {
        assertThatThrownBy(() -> fs.getNode("missing")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> fs.removeNode("missing")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> fs.getEntry("missing")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> fs.removeEntry("missing")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void removeNode_returnsRemovedNodeWithoutTouchingEntries() {
        File f = fs.createFile(new byte[0]);
        Entry<File> entry = fs.link(root, "f", f);

        assertThat(fs.removeNode(f.getId())).isSameAs(f);
        assertThat(fs.getEntries()).contains(entry);
    }

    @Test
    void addEntry_requiresRegisteredNode() {
        File unregistered = new File(fs, new byte[0]);
        Entry<File> entry = new Entry<>(fs, "x", unregistered);

        assertThatThrownBy(() -> fs.addEntry(entry)).isInstanceOf(NotFoundException.class);
        assertThat(fs.containsEntry(entry.getId())).isFalse();
        assertThatThrownBy(() -> fs.link(root, "x", unregistered)).isInstanceOf(NotFoundException.class);
        assertThat(root.containsEntry("x")).isFalse();
    }

    @Test
    void addEntry_rejectsForeignEntriesAndDoubleRegistration() {
        FileSystem other = FileSystem.withRootDirectory("other");
        File foreign = other.createFile(new byte[0]);
        Entry<File> foreignEntry = new Entry<>(other, "x", foreign);

        assertThatThrownBy(() -> fs.addEntry(foreignEntry)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> fs.addNode(foreign)).isInstanceOf(IllegalArgumentException.class);

        File f = fs.createFile(new byte[0]);
        Entry<File> entry = fs.link(root, "f", f);
        assertThatThrownBy(() -> fs.addEntry(entry)).isInstanceOf(IllegalArgumentException.class);
        assertThat(f.getReferences()).isEqualTo(1);
    }

    @Test
    void getNode_typedLookupChecksType() {
        File f = fs.createFile(new byte[0]);

        assertThat(fs.getNode(f.getId(), File.class)).isSameAs(f);
        assertThatThrownBy(() -> fs.getNode(f.getId(), Directory.class))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withRootDirectory_registersRootEntry() {
        FileSystem created = FileSystem.withRootDirectory("created");

        Entry<Directory> rootEntry = created.getRoot().orElseThrow();
        assertThat(rootEntry.getName()).isEqualTo(FileSystem.ROOT_ENTRY_NAME);
        assertThat(created.getRootDirectory().getReferences()).isEqualTo(1);
        assertThat(created.getEntries()).containsExactly(rootEntry);
    }

    @Test
    void getRootDirectory_failsWithoutRoot() {
        FileSystem bare = new FileSystem("bare");

        assertThat(bare.getRoot()).isEmpty();
        assertThatThrownBy(bare::getRootDirectory).isInstanceOf(NotFoundException.class);
    }

    @Test
    void removeEntry_cascadeKeepsSameNamedReplacement() {
        File first = fs.createFile(new byte[]{1});
        Entry<File> stale = fs.link(root, "same", first);
        root.removeEntry("same");
        File second = fs.createFile(new byte[]{2});
        Entry<File> replacement = fs.link(root, "same", second);

        fs.removeEntry(stale.getId());

        assertThat(root.getEntry("same")).isSameAs(replacement);
        assertThat(fs.containsNode(first.getId())).isFalse();
    }

    private long countEntriesTargeting(Node<?> node) {
        return fs.getEntries().stream().filter(e -> e.getNodeId().equals(node.getId())).count();
    }
}
