// Copyright 2026 The Designate Webhook Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package designate.webhook.tools;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.google.common.flogger.FluentLogger;
import designate.webhook.client.DesignateException;
import designate.webhook.client.KeystoneAuthenticator.KeystoneSession;
import designate.webhook.config.WebhookConfig;
import designate.webhook.config.WebhookConfigSettings;
import designate.webhook.module.DaggerWebhookComponent;
import designate.webhook.module.WebhookComponent;
import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;

/** Entry point of the external-dns webhook for OpenStack Designate. */
public final class WebhookMain {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final String PROGRAM_NAME = "designate-webhook";
  private static final String LOGGING_CONFIG_PROPERTY = "java.util.logging.config.file";

  private final WebhookComponent component;

  WebhookMain(WebhookComponent component) {
    this.component = component;
  }

  public static void main(String[] args) throws IOException {
    WebhookFlags flags = new WebhookFlags();
    JCommander jcommander =
        JCommander.newBuilder().programName(PROGRAM_NAME).addObject(flags).build();
    try {
      jcommander.parse(args);
    } catch (ParameterException e) {
      System.err.println(e.getMessage());
      jcommander.usage();
      System.exit(2);
    }
    if (flags.help) {
      jcommander.usage();
      return;
    }
    configureLogging();

    WebhookConfigSettings settings =
        WebhookConfig.loadSettings(flags.getConfigFile(System.getenv()));
    flags.applyTo(settings);
    WebhookMain main = new WebhookMain(DaggerWebhookComponent.factory().create(settings));
    if (!main.start()) {
      System.exit(1);
    }
    Runtime.getRuntime().addShutdownHook(new Thread(main::stop, "shutdown"));
  }

  /**
   * Starts the status server, authenticates against OpenStack and then starts the webhook server.
   *
   * @return false if OpenStack could not be reached, in which case everything is stopped again
   */
  boolean start() throws IOException {
    component.statusServer().start();
    try {
      KeystoneSession session = component.keystoneAuthenticator().getSession();
      logger.atInfo().log("Using OpenStack Designate at %s", session.dnsEndpoint());
      component.apiCallMetrics().setConnected(true);
    } catch (DesignateException e) {
      component.apiCallMetrics().setConnected(false);
      logger.atSevere().withCause(e).log("Failed to connect to OpenStack Designate");
      component.statusServer().stop();
      return false;
    }
    logger.atInfo().log(
        "Serving domain filter %s%s",
        component.designateProvider().getDomainFilter(),
        component.designateProvider().isDryRun() ? " in dry-run mode" : "");
    component.webhookServer().start();
    component.readiness().setReady(true);
    return true;
  }

  void stop() {
    component.readiness().setReady(false);
    component.webhookServer().stop();
    component.statusServer().stop();
  }

  /** Reads the bundled logging.properties unless a logging config file was given. */
  private static void configureLogging() throws IOException {
    if (System.getProperty(LOGGING_CONFIG_PROPERTY) != null) {
      return;
    }
    try (InputStream config = WebhookMain.class.getResourceAsStream("/logging.properties")) {
      if (config != null) {
        LogManager.getLogManager().readConfiguration(config);
      }
    }
  }
}
