package com.mike.contactcardfinder.config;

import com.mike.contactcardfinder.dto.Status;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Data
@ConfigurationProperties(prefix = "contactfinder")
public class ContactFinderProperties {

    /** directory / webmail page the compose surface is opened from */
    private String pageUrl = "https://correoweb.madrid.org/owa/#path=/mail";

    /** landing on a URL containing one of these after navigation means the stored session expired */
    private List<String> loginUrlMarkers = List.of("login", "logon.aspx", "/adfs/");

    private Browser browser = new Browser();
    private Spreadsheet spreadsheet = new Spreadsheet();
    private Processing processing = new Processing();
    private Selectors selectors = new Selectors();
    private WaitTimes waitTimes = new WaitTimes();

    @Data
    public static class Browser {
        private boolean headless = false;

        /** Playwright storage-state JSON written by the interactive login */
        private String sessionFile = "state.json";

        private String locale = "es-ES";
        private String timezoneId = "Europe/Madrid";
        private int viewportWidth = 1280;
        private int viewportHeight = 720;

        private int pageTimeoutMs = 30000;
        private int clickTimeoutMs = 3000;

        private boolean screenshotOnFailure = false;
        private String screenshotDir = "screenshots";
    }

    @Data
    public static class Spreadsheet {
        private String file = "data/correos.xlsx";
        private String sheetName = "Contactos";

        /** 1-based, row 1 holds the headers */
        private int startRow = 2;
        private int emailColumn = 1;
        private int statusColumn = 2;
    }

    @Data
    public static class Processing {
        private int batchSize = 10;

        /**
         * Terminal statuses whose rows are picked up again on the next run.
         * Empty by default: only rows with a blank status are processed.
         */
        private Set<Status> retryStatuses = EnumSet.noneOf(Status.class);

        private boolean mouseEmulation = true;
        private boolean humanTyping = true;

        private boolean runOnStartup = false;
    }

    @Data
    public static class Selectors {
        private String newMessageButton = "button[title=\"Escribir un mensaje nuevo (N)\"]";
        private String toFieldRole = "textbox";
        private String toFieldName = "Para";
        private String card = "div._pe_Y[ispopup='1']";
        private String discardButton = "button[aria-label=\"Descartar\"]";
    }

    @Data
    public static class WaitTimes {
        private int afterNewMessageMs = 1000;
        private int afterFillToMs = 3000;
        private int afterBlurMs = 500;
        private int cardVisibleMs = 5000;
        private int beforeDiscardMs = 2000;
        private int betweenDiscardClicksMs = 1000;
    }
}
