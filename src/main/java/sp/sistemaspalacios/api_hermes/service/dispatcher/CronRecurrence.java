package sp.sistemaspalacios.api_hermes.service.dispatcher;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Recurrencia de un trabajo del despachador, expresada como cron con CRON_TZ.
 */
@Getter
@EqualsAndHashCode
public final class CronRecurrence {

    public static final int MIN_EVERY_MINUTES = 1;
    public static final int MAX_EVERY_MINUTES = 60;

    private final String timezone;
    private final String cron;

    private CronRecurrence(String timezone, String cron) {
        this.timezone = timezone;
        this.cron = cron;
    }

    /** Cada N minutos: {@code CRON_TZ=tz *&#47;N * * * *}. */
    public static CronRecurrence everyMinutes(int minutes, String timezone) {
        if (minutes < MIN_EVERY_MINUTES || minutes > MAX_EVERY_MINUTES) {
            throw new IllegalArgumentException("everyMinutes debe estar entre 1 y 60");
        }
        return new CronRecurrence(validZone(timezone), "*/" + minutes + " * * * *");
    }

    /** Una vez al día a la hora local indicada. */
    public static CronRecurrence dailyAt(int hour, int minute, String timezone) {
        if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
            throw new IllegalArgumentException("Hora diaria inválida: " + hour + ":" + minute);
        }
        return new CronRecurrence(validZone(timezone), minute + " " + hour + " * * *");
    }

    public String expression() {
        return "CRON_TZ=" + timezone + " " + cron;
    }

    static String validZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            throw new IllegalArgumentException("Zona horaria requerida");
        }
        try {
            return ZoneId.of(timezone.trim()).getId();
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Zona horaria inválida: " + timezone);
        }
    }

    @Override
    public String toString() {
        return expression();
    }
}
