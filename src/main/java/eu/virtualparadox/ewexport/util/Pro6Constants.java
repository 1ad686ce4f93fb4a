package eu.virtualparadox.ewexport.util;

public class Pro6Constants {
    public static final int CANVAS_WIDTH = 1920;
    public static final int CANVAS_HEIGHT = 1080;
    public static final int TEXT_PADDING = 20;

    public static final String VERSION_NUMBER = "600";
    public static final String CREATOR_CODE = "1349676880";
    public static final String DOC_TYPE = "0";
    public static final String CATEGORY_SONG = "Song";

    public static final String DEFAULT_FONT_FAMILY = "Arial";
    public static final int DEFAULT_FONT_SIZE = 60;

    public static final String FILE_EXTENSION = ".pro6";
    public static final String UNTITLED_SONG = "Untitled_Song";
    public static final int MAX_FILENAME_LENGTH = 200;

    public static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"no\"?>";

    private Pro6Constants() {
        // prevent instantiation
    }
}
