package dev.vankka.supportdesk.configuration;

import org.spongepowered.configurate.CommentedConfigurationNode;
import org.spongepowered.configurate.hocon.HoconConfigurationLoader;
import org.spongepowered.configurate.objectmapping.ConfigSerializable;
import org.spongepowered.configurate.objectmapping.meta.Comment;
import org.spongepowered.configurate.objectmapping.meta.Setting;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigSerializable
public class Configuration {

    @Setting("BotToken")
    public String botToken = "";

    @Setting("DatabaseUrl")
    public String databaseUrl = "jdbc:h2:./database";

    @Comment("Members with any of these roles can manage tickets like server administrators")
    @Setting("AdminRoleIds")
    public List<String> adminRoleIds = new ArrayList<>();

    @Comment("Name of the channel category ticket channels are created in, for servers that haven't configured one")
    @Setting("DefaultCategoryName")
    public String defaultCategoryName = "tickets";

    @Setting("ConfirmationTimeoutSeconds")
    public int confirmationTimeoutSeconds = 30;

    @Setting("MenuTimeoutSeconds")
    public int menuTimeoutSeconds = 60;

    @Setting("ModalTimeoutSeconds")
    public int modalTimeoutSeconds = 300;

    @Comment("How long a deleted ticket's channel stays around before it is removed")
    @Setting("ChannelDeleteDelaySeconds")
    public int channelDeleteDelaySeconds = 3;

    @Setting("WorkerThreads")
    public int workerThreads = 8;

    /**
     * Loads the configuration from {@code file}, creating the file and writing any missing defaults to it.
     */
    public static Configuration load(Path file) throws IOException {
        if (!Files.exists(file)) {
            Files.createDirectories(file.toAbsolutePath().getParent());
            Files.createFile(file);
        }

        HoconConfigurationLoader loader = HoconConfigurationLoader.builder()
                .path(file)
                .defaultOptions(options -> options.shouldCopyDefaults(true))
                .build();
        CommentedConfigurationNode node = loader.load();

        Configuration configuration = node.get(Configuration.class);
        if (configuration == null) {
            configuration = new Configuration();
        }
        node.set(Configuration.class, configuration);

        loader.save(node);
        return configuration;
    }

    public Duration confirmationTimeout() {
        return Duration.ofSeconds(confirmationTimeoutSeconds);
    }

    public Duration menuTimeout() {
        return Duration.ofSeconds(menuTimeoutSeconds);
    }

    public Duration modalTimeout() {
        return Duration.ofSeconds(modalTimeoutSeconds);
    }

    public Duration channelDeleteDelay() {
        return Duration.ofSeconds(channelDeleteDelaySeconds);
    }
}
