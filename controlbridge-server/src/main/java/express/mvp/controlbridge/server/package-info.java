/** Simulated control bridge for end-to-end tests and local development without hardware. */
package express.mvp.controlbridge.server;
