package dev.mirror.transport.message;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Node of the content store's working tree as returned by {@code getFileTree}.
 * @param name entry name
 * @param path absolute path inside the content store
 * @param type {@code file} or {@code dir}
 * @param children entries of a directory, {@code null} for files
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TreeNode(String name, String path, String type, List<TreeNode> children) {

    public static final String FILE = "file";
    public static final String DIR = "dir";

    public static TreeNode file(String name, String path) {
        return new TreeNode(name, path, FILE, null);
    }

    public static TreeNode directory(String name, String path, List<TreeNode> children) {
        return new TreeNode(name, path, DIR, List.copyOf(children));
    }

    @JsonIgnore
    public boolean isDirectory() {
        return DIR.equals(type);
    }
}
