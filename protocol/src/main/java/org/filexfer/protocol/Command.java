package org.filexfer.protocol;

//одна команда клиента, разобранная из строки
public final class Command {

    public enum Type {
        LIST, GET, PUT, QUIT, UNKNOWN
    }

    private final Type type;
    private final String argument;

    private Command(Type type, String argument) {
        this.type = type;
        this.argument = argument;
    }

    //команда распознается по префиксу строки, имя файла берется как есть
    public static Command parse(String line) {
        if (line.startsWith(Protocol.LIST)) {
            return new Command(Type.LIST, null);
        }
        if (line.startsWith(Protocol.GET + " ")) {
            return new Command(Type.GET, line.substring(Protocol.GET.length() + 1));
        }
        if (line.startsWith(Protocol.PUT + " ")) {
            return new Command(Type.PUT, line.substring(Protocol.PUT.length() + 1));
        }
        if (line.startsWith(Protocol.QUIT)) {
            return new Command(Type.QUIT, null);
        }
        return new Command(Type.UNKNOWN, line);
    }

    public Type getType() {
        return type;
    }

    //имя файла для GET/PUT или исходная строка для нераспознанной команды
    public String getArgument() {
        return argument;
    }

    @Override
    public String toString() {
        return argument == null ? type.name() : type + " " + argument;
    }
}
