package com.settleworks.core.infrastructure;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Gestore della configurazione esterna.
 * Legge 'settleworks.properties' dal classpath, poi un file con lo stesso nome nella working
 * directory può sovrascrivere le singole chiavi. Permette di cambiare i valori di gioco senza ricompilare.
 */
public class CoreConfig {

    public static final String FILE_NAME = "settleworks.properties";

    private final Properties props;

    public CoreConfig(Properties props) {
        this.props = new Properties();
        if (props != null) this.props.putAll(props);
    }

    public static CoreConfig load() {
        Properties p = new Properties();

        try (InputStream in = CoreConfig.class.getResourceAsStream("/" + FILE_NAME)) {
            if (in != null) {
                p.load(in);
            } else {
                System.out.println("⚠️ [Config] " + FILE_NAME + " non trovato nel classpath. Uso valori di DEFAULT.");
            }
        } catch (IOException e) {
            System.err.println("⚠️ [Config] Impossibile leggere dal classpath " + FILE_NAME + ": " + e.getMessage());
        }

        Path local = Path.of(FILE_NAME);
        if (Files.isRegularFile(local)) {
            try (FileInputStream in = new FileInputStream(local.toFile())) {
                p.load(in);
                System.out.println("⚙️ [Config] Override caricati da " + local.toAbsolutePath());
            } catch (IOException e) {
                System.err.println("⚠️ [Config] Impossibile leggere " + local.toAbsolutePath() + ": " + e.getMessage());
            }
        }
        return new CoreConfig(p);
    }

    public static CoreConfig defaults() {
        return new CoreConfig(new Properties());
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            System.err.println("❌ [Config] Errore config per " + key + ": " + val + " non è un intero.");
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Double.parseDouble(val.trim());
        } catch (NumberFormatException e) {
            System.err.println("❌ [Config] Errore config per " + key + ": " + val + " non è un numero.");
            return defaultValue;
        }
    }

    public String getString(String key, String defaultValue) {
        String val = props.getProperty(key);
        return val == null ? defaultValue : val.trim();
    }
}
