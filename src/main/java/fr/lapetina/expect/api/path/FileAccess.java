package fr.lapetina.expect.api.path;

import org.assertj.core.api.AbstractPathAssert;

import java.util.function.Consumer;

/**
 * Access the current thread may have to a file system entry, used as in
 * {@code expect(path).notToBe(READABLE)}.
 */
public enum FileAccess {
    READABLE("readable", AbstractPathAssert::isReadable),
    WRITABLE("writable", AbstractPathAssert::isWritable),
    /**
     * For a directory this means permission to search it, on UNIX systems at least.
     */
    EXECUTABLE("executable", AbstractPathAssert::isExecutable);

    private final String text;
    private final Consumer<AbstractPathAssert<?>> check;

    FileAccess(String text, Consumer<AbstractPathAssert<?>> check) {
        this.text = text;
        this.check = check;
    }

    public String getText() {
        return text;
    }

    Consumer<AbstractPathAssert<?>> getCheck() {
        return check;
    }
}
