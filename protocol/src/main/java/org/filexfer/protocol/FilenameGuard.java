package org.filexfer.protocol;

//проверка имени файла от клиента по символам, без разрешения реального пути
public final class FilenameGuard {

    private FilenameGuard() {
    }

    public static boolean isSafeFilename(String filename) {
        if (filename == null || filename.isEmpty()) {
            return false;
        }

        return !(filename.contains("..") || filename.contains("/") || filename.contains("\\"));
    }
}
