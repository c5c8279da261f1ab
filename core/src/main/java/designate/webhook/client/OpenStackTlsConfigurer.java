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
package designate.webhook.client;

import static com.google.common.base.Strings.isNullOrEmpty;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.net.InetAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.Collection;
import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SNIHostName;
import javax.net.ssl.SNIServerName;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import okhttp3.OkHttpClient;
import okhttp3.internal.tls.OkHostnameVerifier;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;

/**
 * Applies {@link OpenStackTlsSettings} to the OkHttp client shared by Keystone and Designate.
 *
 * <p>Unreadable files are configuration errors and fail startup with an {@link
 * IllegalStateException}.
 */
public final class OpenStackTlsConfigurer {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final String CERTIFICATE_TYPE = "X.509";
  private static final String KEY_STORE_TYPE = "PKCS12";
  @VisibleForTesting static final String KEY_STORE_ALIAS = "client";
  private static final String SSL_CONTEXT_PROTOCOL = "TLS";

  /** Returns the builder, with its socket factory and host name check replaced if needed. */
  public static OkHttpClient.Builder configure(
      OkHttpClient.Builder builder, OpenStackTlsSettings tls) {
    if (isNullOrEmpty(tls.certFile()) != isNullOrEmpty(tls.keyFile())) {
      throw new IllegalStateException("A client certificate needs both certFile and keyFile");
    }
    if (!tls.hasCaFile() && !tls.hasClientCertificate() && !tls.hasServerName()
        && !tls.insecure()) {
      return builder;
    }
    X509TrustManager trustManager;
    if (tls.insecure()) {
      logger.atWarning().log("Server certificates of OpenStack endpoints are not verified");
      trustManager = new TrustingTrustManager();
    } else {
      trustManager = trustManager(tls.hasCaFile() ? loadTrustStore(tls.caFile()) : null);
    }
    KeyManager[] keyManagers =
        tls.hasClientCertificate() ? keyManagers(tls.certFile(), tls.keyFile()) : null;
    SSLSocketFactory socketFactory = sslContext(keyManagers, trustManager).getSocketFactory();
    if (tls.hasServerName()) {
      socketFactory = new ServerNameSocketFactory(socketFactory, tls.serverName());
    }
    builder.sslSocketFactory(socketFactory, trustManager);
    if (tls.insecure()) {
      builder.hostnameVerifier((host, session) -> true);
    } else if (tls.hasServerName()) {
      String serverName = tls.serverName();
      builder.hostnameVerifier(
          (host, session) -> OkHostnameVerifier.INSTANCE.verify(serverName, session));
    }
    return builder;
  }

  @VisibleForTesting
  static KeyStore loadTrustStore(String caFile) {
    try {
      KeyStore keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
      keyStore.load(null, null);
      int index = 0;
      for (Certificate certificate : readCertificates(caFile)) {
        keyStore.setCertificateEntry("ca-" + index++, certificate);
      }
      if (index == 0) {
        throw new IllegalStateException("No certificate found in CA file " + caFile);
      }
      return keyStore;
    } catch (GeneralSecurityException | IOException e) {
      throw new IllegalStateException("Could not create trust store from " + caFile, e);
    }
  }

  @VisibleForTesting
  static KeyManager[] keyManagers(String certFile, String keyFile) {
    Collection<? extends Certificate> chain = readCertificates(certFile);
    if (chain.isEmpty()) {
      throw new IllegalStateException("No certificate found in " + certFile);
    }
    try {
      KeyStore keyStore = KeyStore.getInstance(KEY_STORE_TYPE);
      keyStore.load(null, null);
      keyStore.setKeyEntry(
          KEY_STORE_ALIAS, readPrivateKey(keyFile), new char[0], chain.toArray(new Certificate[0]));
      KeyManagerFactory factory =
          KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
      factory.init(keyStore, new char[0]);
      return factory.getKeyManagers();
    } catch (GeneralSecurityException | IOException e) {
      throw new IllegalStateException("Could not create client key store from " + certFile, e);
    }
  }

  private static Collection<? extends Certificate> readCertificates(String file) {
    try (InputStream in = Files.newInputStream(Path.of(file))) {
      return CertificateFactory.getInstance(CERTIFICATE_TYPE).generateCertificates(in);
    } catch (GeneralSecurityException | IOException e) {
      throw new IllegalStateException("Could not read X.509 certificates from " + file, e);
    }
  }

  private static PrivateKey readPrivateKey(String keyFile) {
    try (Reader reader = Files.newBufferedReader(Path.of(keyFile), StandardCharsets.UTF_8);
        PEMParser pemParser = new PEMParser(reader)) {
      Object parsed = pemParser.readObject();
      JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
      if (parsed instanceof PEMKeyPair) {
        return converter.getPrivateKey(((PEMKeyPair) parsed).getPrivateKeyInfo());
      } else if (parsed instanceof PrivateKeyInfo) {
        return converter.getPrivateKey((PrivateKeyInfo) parsed);
      }
      throw new IllegalStateException(
          String.format(
              "Could not parse TLS private key in %s; unexpected format %s",
              keyFile, parsed != null ? parsed.getClass().getName() : "null"));
    } catch (IOException e) {
      throw new IllegalStateException("Could not read TLS private key from " + keyFile, e);
    }
  }

  private static X509TrustManager trustManager(KeyStore trustStore) {
    try {
      TrustManagerFactory factory =
          TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
      factory.init(trustStore);
      return (X509TrustManager) factory.getTrustManagers()[0];
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Could not initialize TrustManager", e);
    }
  }

  private static SSLContext sslContext(KeyManager[] keyManagers, X509TrustManager trustManager) {
    try {
      SSLContext sslContext = SSLContext.getInstance(SSL_CONTEXT_PROTOCOL);
      sslContext.init(keyManagers, new TrustManager[] {trustManager}, null);
      return sslContext;
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Could not initialize SSLContext", e);
    }
  }

  /** Accepts every server certificate. */
  private static final class TrustingTrustManager implements X509TrustManager {
    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {}

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {}

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  }

  /** Sends a fixed host name in SNI, whatever host the connection goes to. */
  @VisibleForTesting
  static final class ServerNameSocketFactory extends SSLSocketFactory {

    private final SSLSocketFactory delegate;
    private final String serverName;

    ServerNameSocketFactory(SSLSocketFactory delegate, String serverName) {
      this.delegate = delegate;
      this.serverName = serverName;
    }

    @Override
    public String[] getDefaultCipherSuites() {
      return delegate.getDefaultCipherSuites();
    }

    @Override
    public String[] getSupportedCipherSuites() {
      return delegate.getSupportedCipherSuites();
    }

    @Override
    public Socket createSocket(Socket socket, String host, int port, boolean autoClose)
        throws IOException {
      return withServerName(delegate.createSocket(socket, host, port, autoClose));
    }

    @Override
    public Socket createSocket(String host, int port) throws IOException {
      return withServerName(delegate.createSocket(host, port));
    }

    @Override
    public Socket createSocket(String host, int port, InetAddress localHost, int localPort)
        throws IOException {
      return withServerName(delegate.createSocket(host, port, localHost, localPort));
    }

    @Override
    public Socket createSocket(InetAddress host, int port) throws IOException {
      return withServerName(delegate.createSocket(host, port));
    }

    @Override
    public Socket createSocket(
        InetAddress address, int port, InetAddress localAddress, int localPort)
        throws IOException {
      return withServerName(delegate.createSocket(address, port, localAddress, localPort));
    }

    private Socket withServerName(Socket socket) {
      if (socket instanceof SSLSocket) {
        SSLSocket sslSocket = (SSLSocket) socket;
        SSLParameters parameters = sslSocket.getSSLParameters();
        parameters.setServerNames(ImmutableList.<SNIServerName>of(new SNIHostName(serverName)));
        sslSocket.setSSLParameters(parameters);
      }
      return socket;
    }
  }

  private OpenStackTlsConfigurer() {}
}
