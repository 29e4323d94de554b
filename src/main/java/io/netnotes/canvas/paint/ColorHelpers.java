package io.netnotes.canvas.paint;

public class ColorHelpers {
    public static final int BLACK = 0xFF000000;
    public static final int WHITE = 0xFFFFFFFF;
    public static final int TRANSPARENT = 0x00000000;

    public static int argb(int a, int r, int g, int b){
        return ((a & 0xFF) << 24) | ((r & 0xFF) << 16) | ((g & 0xFF) << 8) | (b & 0xFF);
    }

    public static int alpha(int argb){
        return (argb >>> 24) & 0xFF;
    }

    /**
     * Formats as #AARRGGBB
     */
    public static String toHexArgb(int argb){
        return String.format("#%08x", argb);
    }

    /**
     * Parses #RRGGBB or #AARRGGBB, returns defaultColor when the text is not a color
     */
    public static int parseHexArgb(String text, int defaultColor){
        if(text == null){
            return defaultColor;
        }
        String hex = text.trim();
        if(hex.startsWith("#")){
            hex = hex.substring(1);
        }
        try{
            if(hex.length() == 6){
                return 0xFF000000 | Integer.parseUnsignedInt(hex, 16);
            }
            if(hex.length() == 8){
                return (int) Long.parseLong(hex, 16);
            }
        }catch(NumberFormatException e){
            return defaultColor;
        }
        return defaultColor;
    }
}
