package org.learningjava.uniagent.support;

/** Shared documents for validator, checker and controller tests. */
public final class Fixtures {

    private Fixtures() {}

    /** Passes the structural validator and raises no heuristic issue at all. */
    public static final String CLEAN_GAME = """
            <!DOCTYPE html>
            <html lang="en">
            <head>
            <meta charset="utf-8">
            <meta name="viewport" content="width=device-width,initial-scale=1">
            <title>Dodge</title>
            <style>body{margin:0}</style>
            </head>
            <body>
            <canvas id="game"></canvas>
            <button id="restart">Restart</button>
            <script>
            const c = document.getElementById('game');
            document.getElementById('restart').addEventListener('click', () => reset());
            c.addEventListener('pointerdown', e => tap(e));
            function reset() {}
            function tap(e) { if (collision(e)) reset(); }
            function collision(e) { return false; }
            function loop() { requestAnimationFrame(loop); }
            requestAnimationFrame(loop);
            </script>
            </body>
            </html>
            """;

    /** CLEAN_GAME with a second script opened and never closed. */
    public static final String TWO_SCRIPT_OPENS = CLEAN_GAME.replace(
            "</body>", "<script src=\"extra.js\">\n</body>");
}
