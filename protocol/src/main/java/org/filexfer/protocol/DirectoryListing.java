package org.filexfer.protocol;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

//тело ответа на LIST: строка <name>\t<kind> на каждую запись каталога, без сортировки
public final class DirectoryListing {

    private DirectoryListing() {
    }

    public static String of(Path dir) throws IOException {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            return render(entries);
        }
    }

    //ошибка во время обхода приходит непроверяемым исключением, разворачиваем ее в IOException
    static String render(Iterable<Path> entries) throws IOException {
        StringBuilder listing = new StringBuilder();
        try {
            for (Path entry : entries) {
                listing.append(entry.getFileName()).append('\t').append(kindOf(entry)).append('\n');
            }
        } catch (DirectoryIteratorException e) {
            throw e.getCause();
        }
        return listing.toString();
    }

    //симлинки не разыменовываются и попадают в other
    static String kindOf(Path entry) {
        if (Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)) {
            return Protocol.KIND_FILE;
        }
        if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
            return Protocol.KIND_DIR;
        }
        return Protocol.KIND_OTHER;
    }
}
